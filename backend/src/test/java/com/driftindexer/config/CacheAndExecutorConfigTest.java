package com.driftindexer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
}, properties = {
        "driftindexer.fetch.pool-size=6",
        "driftindexer.scheduler.pool-size=3"
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.FETCH_EXECUTOR)
    Executor fetchExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.POLL_SCHEDULER)
    ThreadPoolTaskScheduler pollScheduler;

    @Test
    @DisplayName("cursor cache is created and usable")
    void cursorCacheCreated() {
        assertThat(cacheManager.getCache(CaffeineConfig.CURSOR_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.CURSOR_CACHE).put("account", "SIG1");
        assertThat(cacheManager.getCache(CaffeineConfig.CURSOR_CACHE).get("account", String.class)).isEqualTo("SIG1");
    }

    @Test
    @DisplayName("fetch executor is sized from configuration")
    void fetchExecutorCreated() {
        assertThat(fetchExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) fetchExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(6);
        assertThat(executor.getMaxPoolSize()).isEqualTo(6);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("fetch-");
    }

    @Test
    @DisplayName("poll scheduler is created and configured")
    void pollSchedulerCreated() {
        assertThat(pollScheduler.getThreadNamePrefix()).isEqualTo("poll-");
        assertThat(pollScheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(3);
    }
}
