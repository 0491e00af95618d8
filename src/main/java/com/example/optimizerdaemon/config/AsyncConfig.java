package com.example.optimizerdaemon.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread configuration for the daemon loop.
 * Exactly one worker: cycles never overlap.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "daemonExecutor")
    public TaskExecutor daemonExecutor(DaemonProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("optimizer-");
        // A running action must never be interrupted by context close
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getDaemon().getShutdownTimeoutSeconds());
        executor.initialize();
        return executor;
    }
}
