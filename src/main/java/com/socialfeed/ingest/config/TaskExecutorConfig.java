package com.socialfeed.ingest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${app.ingestion.workers:2}")
    private int workers;

    @Value("${app.ingestion.queue-capacity:50}")
    private int queueCapacity;

    /**
     * Bounded pool for user-triggered runs. Rejects instead of running on the caller thread.
     */
    @Bean("ingestionExecutor")
    public TaskExecutor ingestionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, workers));
        executor.setMaxPoolSize(Math.max(1, workers));
        executor.setQueueCapacity(Math.max(0, queueCapacity));
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.AbortPolicy());
        executor.setThreadNamePrefix("IngestWorker-");
        executor.initialize();
        return executor;
    }
}
