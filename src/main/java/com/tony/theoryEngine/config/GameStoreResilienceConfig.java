package com.tony.theoryEngine.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;

@Slf4j
@Configuration
public class GameStoreResilienceConfig {

    @Bean
    public Retry gameStoreRetry(TheoryEngineProperties properties) {
        TheoryEngineProperties.Store store = properties.getStore();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(store.getInitialBackoffMillis()),
                store.getBackoffMultiplier(),
                store.getJitter()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(store.getMaxAttempts())
                .intervalFunction(intervalFunction)
                // Seules les pannes transitoires de la base sont rejouées
                .retryExceptions(TransientDataAccessException.class,
                        DataAccessResourceFailureException.class,
                        CannotCreateTransactionException.class)
                .build();
        Retry retry = Retry.of("historicalGameStore", config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("🔁 Historical Game Store indisponible, tentative {} : {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "?"));
        return retry;
    }
}
