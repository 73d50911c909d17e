package com.xcpradar.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Counterparty indexer (API v2) connection, paging and retry settings.
 */
@Validated
@ConfigurationProperties(prefix = "xcpradar.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** Base URL of the v2 API, without trailing slash. */
    @NotBlank
    private String baseUrl = "https://api.counterparty.io:4000/v2";

    /** Events requested per page. Default 100. */
    @Min(1)
    private int pageSize = 100;

    /** Hard cap on pages walked per category per call; a warning is logged when hit. */
    @Min(1)
    private int maxPages = 50;

    /** Per-request timeout in seconds. Default 30. */
    private int timeoutSeconds = 30;

    /** Local request budget (resilience4j limiter). Default 5 req/s. */
    private int maxRequestsPerSecond = 5;

    /** Max wait for a limiter permit before giving up the request. */
    private long limiterTimeoutMs = 10_000L;

    @Valid
    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        /** Base delay in ms for first retry; doubles each attempt. Default 1000. */
        private long baseDelayMs = 1000L;

        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;

        /** Total attempts per request including the first. Default 3. */
        @Min(1)
        private int maxAttempts = 3;
    }
}
