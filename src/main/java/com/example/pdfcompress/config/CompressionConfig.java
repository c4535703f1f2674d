package com.example.pdfcompress.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the compression settings and the thread pool that runs each request in its own task.
 */
@Configuration
@EnableConfigurationProperties(CompressionProperties.class)
public class CompressionConfig {

    /**
     * Creates the pool used by the compression worker. Tasks share threads but never state:
     * every submitted request owns its own document graph and progress reporter.
     *
     * @param properties bound compression settings
     * @return a configured AsyncTaskExecutor bean
     */
    @Bean("compressionTaskExecutor")
    public AsyncTaskExecutor compressionTaskExecutor(CompressionProperties properties) {
        CompressionProperties.Worker worker = properties.worker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.corePoolSize());
        executor.setMaxPoolSize(worker.maxPoolSize());
        executor.setQueueCapacity(worker.queueCapacity());
        executor.setThreadNamePrefix("pdf-compress-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
