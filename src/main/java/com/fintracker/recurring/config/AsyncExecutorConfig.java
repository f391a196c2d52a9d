package com.fintracker.recurring.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    @Bean(name = "recurringGenerationTaskExecutor")
    public Executor recurringGenerationTaskExecutor(RecurringGenerationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.parallelism());
        executor.setMaxPoolSize(properties.parallelism());
        // one task per template; the caller waits for all of them
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("recurring-gen-");
        executor.initialize();
        return executor;
    }
}
