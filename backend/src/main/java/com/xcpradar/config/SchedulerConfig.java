package com.xcpradar.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Shared market scheduler: the monitor's fixed-rate poll and the retention purge run here.
 * On shutdown an in-flight poll cycle is allowed to finish (bounded) before the pool closes.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    static final int POOL_SIZE = 2;
    static final int SHUTDOWN_GRACE_SECONDS = 30;

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(POOL_SIZE);
        scheduler.setThreadNamePrefix("market-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(SHUTDOWN_GRACE_SECONDS);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled market task", t));
        scheduler.initialize();
        return scheduler;
    }
}
