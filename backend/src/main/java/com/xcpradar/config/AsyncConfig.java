package com.xcpradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. ledger-fetch-executor runs the four per-cycle category fetches side by side.
 */
@Configuration
public class AsyncConfig {

    public static final String LEDGER_FETCH_EXECUTOR = "ledger-fetch-executor";

    @Bean(name = LEDGER_FETCH_EXECUTOR)
    public Executor ledgerFetchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("ledger-fetch-");
        e.initialize();
        return e;
    }
}
