package com.statementradar.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: classification-executor scores pages of large documents,
 * extraction-executor runs one vision call per selected page.
 */
@Configuration
public class AsyncConfig {

    public static final String CLASSIFICATION_EXECUTOR = "classification-executor";
    public static final String EXTRACTION_EXECUTOR = "extraction-executor";

    @Bean(name = CLASSIFICATION_EXECUTOR)
    public Executor classificationExecutor(
            @Value("${statementradar.classification.workers:8}") int workers) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, workers));
        e.setMaxPoolSize(Math.max(1, workers));
        e.setThreadNamePrefix("classify-");
        e.initialize();
        return e;
    }

    @Bean(name = EXTRACTION_EXECUTOR)
    public Executor extractionExecutor(
            @Value("${statementradar.extraction.concurrency:5}") int concurrency) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, concurrency));
        e.setMaxPoolSize(Math.max(1, concurrency));
        e.setThreadNamePrefix("extract-");
        e.initialize();
        return e;
    }
}
