package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.exception.ModelFitException;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.TrainedModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ajustement linéaire régularisé L2 sur features standardisées.
 * Binaire : régression logistique par descente de gradient (déterministe).
 * Numérique : ridge en forme fermée.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelTrainingService {

    private final TheoryEngineProperties properties;

    public TrainedModel fit(double[][] x, double[] y, List<String> names, MetricType metricType) {
        int n = x.length;
        int p = names.size();
        if (n == 0) {
            throw new ModelFitException("Aucune ligne d'entraînement");
        }

        double[] means = new double[p];
        double[] stds = new double[p];
        for (int j = 0; j < p; j++) {
            SummaryStatistics stats = new SummaryStatistics();
            for (double[] row : x) {
                if (!Double.isNaN(row[j])) {
                    stats.addValue(row[j]);
                }
            }
            // Écart-type de population
            means[j] = stats.getN() == 0 ? 0 : stats.getMean();
            stds[j] = stats.getN() == 0 ? 0 : Math.sqrt(stats.getPopulationVariance());
        }

        double[][] z = new double[n][p];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                double v = x[i][j];
                z[i][j] = Double.isNaN(v) || stds[j] == 0 ? 0.0 : (v - means[j]) / stds[j];
            }
        }

        double yMean = StatUtils.mean(y);

        TrainedModel model = metricType == MetricType.BINARY
                ? fitLogistic(z, y, names, means, stds, yMean)
                : fitRidge(z, y, names, means, stds, yMean);

        for (double w : model.weights()) {
            if (!Double.isFinite(w)) {
                throw new ModelFitException("Poids non fini après ajustement (divergence)");
            }
        }
        if (!Double.isFinite(model.bias())) {
            throw new ModelFitException("Biais non fini après ajustement (divergence)");
        }
        return model;
    }

    private TrainedModel fitLogistic(double[][] z, double[] y, List<String> names,
                                     double[] means, double[] stds, double yMean) {
        TheoryEngineProperties.Model cfg = properties.getModel();
        int n = z.length;
        int p = names.size();
        double[] w = new double[p];
        // Départ au log-odds de la base pour converger plus vite
        double b = yMean > 0 && yMean < 1 ? Math.log(yMean / (1 - yMean)) : 0.0;

        for (int epoch = 0; epoch < cfg.getEpochs(); epoch++) {
            double[] gradW = new double[p];
            double gradB = 0;
            for (int i = 0; i < n; i++) {
                double s = b;
                for (int j = 0; j < p; j++) {
                    s += w[j] * z[i][j];
                }
                double err = TrainedModel.sigmoid(s) - y[i];
                for (int j = 0; j < p; j++) {
                    gradW[j] += err * z[i][j];
                }
                gradB += err;
            }
            for (int j = 0; j < p; j++) {
                w[j] -= cfg.getLearningRate() * (gradW[j] / n + cfg.getL2() * w[j]);
            }
            b -= cfg.getLearningRate() * gradB / n;
        }
        log.debug("Logistique ajustée : {} lignes, {} features, {} epochs", n, p, cfg.getEpochs());
        return new TrainedModel(MetricType.BINARY, List.copyOf(names), means, stds, w, b, yMean);
    }

    private TrainedModel fitRidge(double[][] z, double[] y, List<String> names,
                                  double[] means, double[] stds, double yMean) {
        int n = z.length;
        int p = names.size();
        RealMatrix design = new Array2DRowRealMatrix(z, false);
        double[] centered = new double[n];
        for (int i = 0; i < n; i++) {
            centered[i] = y[i] - yMean;
        }
        RealVector target = new ArrayRealVector(centered, false);

        // (Z'Z + lambda.n.I) w = Z'(y - ybar)
        RealMatrix gram = design.transpose().multiply(design);
        double lambda = properties.getModel().getL2() * n;
        for (int j = 0; j < p; j++) {
            gram.addToEntry(j, j, lambda);
        }
        try {
            DecompositionSolver solver = new LUDecomposition(gram).getSolver();
            if (!solver.isNonSingular()) {
                throw new ModelFitException("Matrice des features singulière (features colinéaires)");
            }
            double[] w = solver.solve(design.transpose().operate(target)).toArray();
            log.debug("Ridge ajustée : {} lignes, {} features", n, p);
            return new TrainedModel(MetricType.NUMERIC, List.copyOf(names), means, stds, w, yMean, yMean);
        } catch (SingularMatrixException e) {
            throw new ModelFitException("Matrice des features singulière (features colinéaires)", e);
        }
    }
}
