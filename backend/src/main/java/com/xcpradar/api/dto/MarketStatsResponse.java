package com.xcpradar.api.dto;

import java.time.Instant;

/**
 * Store totals. The *Last30Days counts cover the retention window; oldestBlockTime is null on an empty store.
 */
public record MarketStatsResponse(
        long totalTransactions,
        long sales,
        long listings,
        long salesLast30Days,
        long listingsLast30Days,
        Instant oldestBlockTime
) {
}
