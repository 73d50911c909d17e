package com.xcpradar.ingestion.config;

import com.xcpradar.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Ledger adapter wiring: request retry policy, local rate limiter, monitor startup retry policy.
 */
@Configuration
@EnableConfigurationProperties({ LedgerProperties.class, MonitorProperties.class, StoreProperties.class })
public class IngestionAdapterConfig {

    public static final String LEDGER_RETRY_POLICY = "ledgerRetryPolicy";
    public static final String STARTUP_RETRY_POLICY = "monitorStartupRetryPolicy";
    public static final String LEDGER_RATE_LIMITER = "ledgerRateLimiter";

    @Bean(name = LEDGER_RETRY_POLICY)
    public RetryPolicy ledgerRetryPolicy(LedgerProperties properties) {
        LedgerProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean(name = STARTUP_RETRY_POLICY)
    public RetryPolicy monitorStartupRetryPolicy(MonitorProperties properties) {
        MonitorProperties.StartupRetry retry = properties.getStartupRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean(name = LEDGER_RATE_LIMITER)
    public RateLimiter ledgerRateLimiter(LedgerProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("counterparty-api", config);
    }
}
