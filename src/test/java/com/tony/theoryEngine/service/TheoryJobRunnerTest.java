package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.config.TheoryExecutionConfig;
import com.tony.theoryEngine.exception.OperationTimeoutException;
import com.tony.theoryEngine.exception.TheoryConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TheoryJobRunnerTest {

    private ThreadPoolTaskExecutor executor;
    private TheoryEngineProperties properties;
    private TheoryJobRunner runner;

    @BeforeEach
    void setUp() {
        properties = new TheoryEngineProperties();
        executor = new TheoryExecutionConfig().theoryExecutor(properties);
        runner = new TheoryJobRunner(executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Renvoie le résultat de la tâche")
    void returnsResult() {
        assertThat(runner.run("analyze", () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("Une exception métier remonte telle quelle")
    void rethrowsRuntimeCause() {
        assertThatThrownBy(() -> runner.run("analyze", () -> {
            throw new TheoryConfigurationException("filters", "Les filtres sont requis");
        })).isInstanceOf(TheoryConfigurationException.class).hasMessage("Les filtres sont requis");
    }

    @Test
    @DisplayName("Une exception vérifiée est enveloppée")
    void wrapsCheckedCause() {
        assertThatThrownBy(() -> runner.run("analyze", () -> {
            throw new IOException("disque plein");
        })).isInstanceOf(IllegalStateException.class).hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Délai dépassé : tâche interrompue et OperationTimeoutException")
    void timesOutAndInterrupts() throws InterruptedException {
        properties.getExecution().setTimeoutSeconds(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> runner.run("walkforward", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        })).isInstanceOf(OperationTimeoutException.class).hasMessageContaining("walkforward");

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("checkpoint lève une exception si le thread a été interrompu")
    void checkpointDetectsInterruption() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> TheoryJobRunner.checkpoint("features"))
                    .isInstanceOf(OperationTimeoutException.class)
                    .hasMessageContaining("features");
        } finally {
            // Nettoie le flag pour ne pas polluer les autres tests
            Thread.interrupted();
        }
    }
}
