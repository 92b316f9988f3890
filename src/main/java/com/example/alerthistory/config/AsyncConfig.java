package com.example.alerthistory.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor configuration for deadline-bounded state store reads.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "suppressionExecutor")
    public ThreadPoolTaskExecutor suppressionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("suppression-");
        executor.initialize();
        return executor;
    }
}
