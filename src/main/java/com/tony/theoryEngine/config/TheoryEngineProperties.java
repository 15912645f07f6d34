package com.tony.theoryEngine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "theory.engine")
@Data
public class TheoryEngineProperties {

    private Evaluation evaluation = new Evaluation();
    private Pruning pruning = new Pruning();
    private Model model = new Model();
    private MonteCarlo monteCarlo = new MonteCarlo();
    private Walkforward walkforward = new Walkforward();
    private Execution execution = new Execution();
    private Store store = new Store();

    /**
     * Bandes de verdict. Politique ajustable, pas un test statistique.
     */
    @Data
    public static class Evaluation {
        private double strongLift = 0.10;
        private double moderateLift = 0.05;
        private int largeSample = 5000;
        private int moderateSample = 1000;
        private int smallSampleWarning = 30;
        private int minCorrelationSample = 5;
        private int significantCorrelationSample = 30;
        private double significantCorrelation = 0.03;
    }

    @Data
    public static class Pruning {
        private double maxMissingFraction = 0.5;
        private int minValues = 5;
        private double minStd = 1e-9;
        private double collinearityThreshold = 0.98;
        private double zeroWeightEpsilon = 1e-6;
    }

    @Data
    public static class Model {
        private double learningRate = 0.1;
        private int epochs = 300;
        private double l2 = 0.01;
        private double roiProxyThreshold = 0.55;
    }

    @Data
    public static class MonteCarlo {
        private int runs = 2000;
        private long seed = 42L;
        private int minBets = 10;
    }

    @Data
    public static class Walkforward {
        private int minTrainRows = 30;
        private int minTestRows = 5;
    }

    @Data
    public static class Execution {
        private int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors());
        private int queueCapacity = 100;
        private long timeoutSeconds = 300;
    }

    // Retry côté Historical Game Store uniquement
    @Data
    public static class Store {
        private int maxAttempts = 3;
        private long initialBackoffMillis = 200;
        private double backoffMultiplier = 2.0;
        private double jitter = 0.3;
        private int queryChunkSize = 1000;
    }
}
