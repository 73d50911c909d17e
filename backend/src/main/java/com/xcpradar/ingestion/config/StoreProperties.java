package com.xcpradar.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Transaction store location and retention schedule.
 */
@Validated
@ConfigurationProperties(prefix = "xcpradar.store")
@NoArgsConstructor
@Getter
@Setter
public class StoreProperties {

    /** Directory holding transactions.db; created on startup when missing. */
    @NotBlank
    private String path = "./data/transactions";

    /** Retention purge interval. Default 24h. */
    @Min(1)
    private long purgeIntervalMs = 86_400_000L;

    /** Rows whose block time is older than this many days are purged. */
    @Min(1)
    private int retentionDays = 30;
}
