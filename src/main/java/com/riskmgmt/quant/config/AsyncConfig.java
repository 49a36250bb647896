package com.riskmgmt.quant.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Worker pool for Monte Carlo chunks.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "simulationExecutor")
    public Executor simulationExecutor(QuantEngineProperties properties) {
        int parallelism = Math.max(1, properties.getSimulation().getParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("simulation-");
        executor.initialize();
        return executor;
    }
}
