package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.exception.OperationTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Exécute une opération sur le pool dédié avec un délai maximal côté appelant.
 * Au-delà, la tâche est interrompue ; les étapes vérifient l'interruption via {@link #checkpoint(String)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TheoryJobRunner {

    private final AsyncTaskExecutor theoryExecutor;
    private final TheoryEngineProperties properties;

    public <T> T run(String operation, Callable<T> task) {
        long timeout = properties.getExecution().getTimeoutSeconds();
        Future<T> future = theoryExecutor.submit(task);
        try {
            return future.get(timeout, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏱️ Opération {} interrompue après {}s", operation, timeout);
            throw new OperationTimeoutException("L'opération " + operation + " a dépassé " + timeout + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException("L'opération " + operation + " a été interrompue", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Échec de l'opération " + operation, cause);
        }
    }

    /**
     * À appeler entre deux étapes : lève {@link OperationTimeoutException} si la tâche a été annulée.
     */
    public static void checkpoint(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationTimeoutException("Opération annulée avant l'étape " + stage);
        }
    }
}
