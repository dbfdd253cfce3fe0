package com.driftindexer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. fetch-executor runs the per-signature transaction fetches of every account's tick.
 */
@Configuration
public class AsyncConfig {

    public static final String FETCH_EXECUTOR = "fetch-executor";

    @Bean(name = FETCH_EXECUTOR)
    public Executor fetchExecutor(@Value("${driftindexer.fetch.pool-size:8}") int poolSize) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(poolSize);
        e.setMaxPoolSize(poolSize);
        e.setThreadNamePrefix("fetch-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(60);
        e.initialize();
        return e;
    }
}
