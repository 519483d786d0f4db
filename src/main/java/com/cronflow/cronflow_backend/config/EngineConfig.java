package com.cronflow.cronflow_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Threads and time for the engine.
 * workflowTaskScheduler fires schedules; workflowTaskExecutor runs the graph walks, so a long run
 * never holds a scheduler thread.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "workflowTaskExecutor")
    public ThreadPoolTaskExecutor workflowTaskExecutor(
            @Value("${cronflow.executor.core-pool-size:4}") int corePoolSize,
            @Value("${cronflow.executor.max-pool-size:16}") int maxPoolSize,
            @Value("${cronflow.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("workflow-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean(name = "workflowTaskScheduler")
    public ThreadPoolTaskScheduler workflowTaskScheduler(@Value("${cronflow.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("workflow-schedule-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
