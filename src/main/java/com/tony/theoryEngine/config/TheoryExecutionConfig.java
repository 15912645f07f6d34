package com.tony.theoryEngine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TheoryExecutionConfig {

    // Pool borné : une analyse lourde ne bloque jamais les threads HTTP
    @Bean(name = "theoryExecutor")
    public ThreadPoolTaskExecutor theoryExecutor(TheoryEngineProperties properties) {
        int poolSize = properties.getExecution().getPoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(properties.getExecution().getQueueCapacity());
        executor.setThreadNamePrefix("theory-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
