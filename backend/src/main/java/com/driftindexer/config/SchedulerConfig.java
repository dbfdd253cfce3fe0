package com.driftindexer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool for the per-account poll ticks.
 */
@Configuration
public class SchedulerConfig {

    public static final String POLL_SCHEDULER = "poll-scheduler";

    @Bean(name = POLL_SCHEDULER)
    public ThreadPoolTaskScheduler pollScheduler(@Value("${driftindexer.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(poolSize);
        s.setThreadNamePrefix("poll-");
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(60);
        s.initialize();
        return s;
    }
}
