package com.xcpradar.domain;

/**
 * Aggregate row counts for health reporting. {@code oldestTimestamp} is null when the store is empty.
 */
public record StoreStats(long totalTransactions, long sales, long listings, Long oldestTimestamp) {
}
