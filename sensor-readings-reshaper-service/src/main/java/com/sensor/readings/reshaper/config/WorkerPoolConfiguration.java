package com.sensor.readings.reshaper.config;

import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.sensor.readings.reshaper.config.properties.ReshaperConfigurationProperties;

import jakarta.annotation.PreDestroy;

/**
 * Configuration of the worker pool running (location, year) partitions.
 *
 * <p>One pool is shared by every configured location so the number of concurrent partitions, and
 * with it the number of concurrent blocking object store calls, never exceeds
 * {@code reshaper.workers}.
 */
@Configuration
public class WorkerPoolConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPoolConfiguration.class);

    private final ReshaperConfigurationProperties reshaperProperties;

    // Keep reference to executor for graceful shutdown
    private ThreadPoolTaskExecutor partitionExecutor;

    public WorkerPoolConfiguration(ReshaperConfigurationProperties reshaperProperties) {
        this.reshaperProperties = reshaperProperties;
    }

    /**
     * Creates the fixed-size partition executor. The queue is unbounded since every partition of a
     * run is submitted up front and must eventually run.
     */
    @Bean(name = "partitionExecutor")
    public ThreadPoolTaskExecutor partitionExecutor() {
        int workers = reshaperProperties.workers();

        partitionExecutor = new ThreadPoolTaskExecutor();
        partitionExecutor.setCorePoolSize(workers);
        partitionExecutor.setMaxPoolSize(workers);
        partitionExecutor.setThreadNamePrefix("partition-worker-");
        partitionExecutor.setWaitForTasksToCompleteOnShutdown(true);
        partitionExecutor.setAwaitTerminationSeconds(30);
        partitionExecutor.initialize();

        logger.info("Initialized partition executor - workers: {}", workers);

        return partitionExecutor;
    }

    /**
     * Stops the executor, waiting for running partitions to finish their current file.
     */
    @PreDestroy
    public void shutdown() {
        if (partitionExecutor == null) {
            return;
        }
        ThreadPoolExecutor executor = partitionExecutor.getThreadPoolExecutor();
        logger.info("Shutting down partition executor - Queue size: {}, Active threads: {}",
            executor.getQueue().size(), executor.getActiveCount());

        try {
            partitionExecutor.shutdown();
            if (!executor.awaitTermination(45, TimeUnit.SECONDS)) {
                logger.warn("Partitions did not complete within 45 seconds, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Shutdown interrupted, forcing immediate termination");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
