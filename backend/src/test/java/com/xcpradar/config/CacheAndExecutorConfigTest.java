package com.xcpradar.config;

import com.github.benmanes.caffeine.cache.Cache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    @Qualifier(CaffeineConfig.BLOCK_TIME_CACHE)
    Cache<Long, Long> blockTimeCache;

    @Autowired
    @Qualifier(AsyncConfig.LEDGER_FETCH_EXECUTOR)
    Executor ledgerFetchExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("block time cache is created and usable")
    void blockTimeCacheUsable() {
        blockTimeCache.put(870_000L, 1_700_000_000L);

        assertThat(blockTimeCache.getIfPresent(870_000L)).isEqualTo(1_700_000_000L);
        assertThat(blockTimeCache.getIfPresent(870_001L)).isNull();
    }

    @Test
    @DisplayName("ledger fetch executor has one thread per event category")
    void ledgerFetchExecutor() {
        assertThat(ledgerFetchExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) ledgerFetchExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(4);
        assertThat(e.getMaxPoolSize()).isEqualTo(4);
        assertThat(e.getThreadNamePrefix()).isEqualTo("ledger-fetch-");
    }

    @Test
    @DisplayName("market scheduler pool is created and runs tasks on its own threads")
    void schedulerPoolCreated() throws Exception {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("market-scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(SchedulerConfig.POOL_SIZE);

        String threadName = schedulerPool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

        assertThat(threadName).startsWith("market-scheduler-");
    }
}
