package com.xcpradar.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Transaction monitor schedule, DEX toggle, startup retry and asset admission.
 */
@Validated
@ConfigurationProperties(prefix = "xcpradar.monitor")
@NoArgsConstructor
@Getter
@Setter
public class MonitorProperties {

    /** When false the monitor is never started; the store and REST API still work. */
    private boolean enabled = true;

    /** Fixed rate between poll cycles. Default 3 minutes. */
    @Min(1)
    private long pollIntervalSeconds = 180;

    /** Fetch DEX order matches and open orders in addition to dispenser activity. */
    private boolean dexEnabled = true;

    /** Assets treated as the payment side of a DEX trade. */
    private List<String> quoteAssets = new ArrayList<>(List.of("XCP", "BTC", "PEPECASH"));

    @Valid
    private StartupRetry startupRetry = new StartupRetry();

    private AssetFilter assetFilter = new AssetFilter();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class StartupRetry {

        private long baseDelayMs = 1000L;

        private double jitterFactor = 0.2;

        /** Attempts to read the ledger height before start fails. Default 5. */
        @Min(1)
        private int maxAttempts = 5;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class AssetFilter {

        /** Off means every asset is admitted. */
        private boolean enabled = false;

        /** Admitted assets when enabled; compared case-insensitively. */
        private List<String> allowedAssets = new ArrayList<>();
    }
}
