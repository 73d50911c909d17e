package com.xcpradar.ingestion.history;

import com.xcpradar.domain.MarketFeed;
import com.xcpradar.domain.StoreStats;
import com.xcpradar.domain.Transaction;
import com.xcpradar.ingestion.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side over the transaction store for the REST API. Validates window sizes; the store does the rest.
 */
@Service
@RequiredArgsConstructor
public class MarketHistoryQueryService {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    private final TransactionStore store;

    public List<Transaction> recentSales(int limit) {
        return store.querySales(checkLimit(limit));
    }

    public List<Transaction> recentListings(int limit) {
        return store.queryListings(checkLimit(limit));
    }

    public MarketFeed recent(int limit) {
        return store.queryCombined(checkLimit(limit));
    }

    public MarketSummary summary() {
        return new MarketSummary(store.getTotalSales(), store.getTotalListings(), store.getStats());
    }

    public boolean isStoreReady() {
        return store.isInitialized();
    }

    private static int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }

    /**
     * Retention-window totals plus whole-table stats.
     */
    public record MarketSummary(long salesLast30Days, long listingsLast30Days, StoreStats stats) {
    }
}
