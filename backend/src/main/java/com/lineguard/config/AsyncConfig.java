package com.lineguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for per-item pipeline work (invoice items, batch match, batch price validation).
 * Callers submit with CompletableFuture and join in input order.
 */
@Configuration
public class AsyncConfig {

    public static final String PIPELINE_EXECUTOR = "pipeline-executor";

    @Bean(name = PIPELINE_EXECUTOR)
    public Executor pipelineExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(16);
        e.setQueueCapacity(500);
        e.setThreadNamePrefix("pipeline-");
        e.initialize();
        return e;
    }
}
