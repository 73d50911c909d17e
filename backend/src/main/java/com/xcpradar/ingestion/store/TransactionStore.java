package com.xcpradar.ingestion.store;

import com.xcpradar.domain.MarketFeed;
import com.xcpradar.domain.StoreStats;
import com.xcpradar.domain.Transaction;
import com.xcpradar.domain.TransactionType;
import com.xcpradar.ingestion.config.StoreProperties;
import com.xcpradar.ingestion.store.migration.SchemaMigrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deduplicated, durable transaction history keyed by tx hash. Inserts are insert-or-ignore;
 * {@link #markNotified(String)} is the only update and {@link #purgeOld()} the only delete.
 * Windowed queries return the newest {@code limit} rows ordered oldest-first for display.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionStore {

    private static final String SALE_TYPES = inList(TransactionType.SALES);
    private static final String LISTING_TYPES = inList(TransactionType.LISTINGS);

    private final JdbcTemplate jdbc;
    private final SchemaMigrator schemaMigrator;
    private final StoreProperties properties;
    private final Clock clock;

    private volatile boolean initialized;

    /**
     * Migrates the schema to the latest version and runs one retention purge. Safe to call repeatedly.
     */
    public synchronized void initialize() {
        int version = schemaMigrator.migrate();
        initialized = true;
        int purged = purgeOld();
        Long rows = jdbc.queryForObject("SELECT COUNT(*) FROM transactions", Long.class);
        log.info("Transaction store ready: schema v{}, {} rows, {} purged", version, rows, purged);
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Inserts unless a row with the same hash exists. Returns true only when a row was written.
     */
    public boolean insert(Transaction transaction) {
        requireInitialized();
        int rows = jdbc.update("""
                        INSERT OR IGNORE INTO transactions (tx_hash, type, asset, amount, price, payment_asset,
                                                            block_time, block_index, notified, created_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                transaction.getTxHash(),
                transaction.getType().name(),
                transaction.getAsset(),
                transaction.getAmount(),
                transaction.getPrice(),
                transaction.getPaymentAsset(),
                transaction.getTimestamp(),
                transaction.getBlockIndex(),
                transaction.isNotified() ? 1 : 0,
                transaction.getCreatedAt());
        return rows > 0;
    }

    public boolean exists(String txHash) {
        requireInitialized();
        List<Integer> found = jdbc.queryForList("SELECT 1 FROM transactions WHERE tx_hash = ? LIMIT 1", Integer.class, txHash);
        return !found.isEmpty();
    }

    /**
     * Sets notified for the hash. Unknown hashes are a no-op; returns whether a row matched.
     */
    public boolean markNotified(String txHash) {
        requireInitialized();
        return jdbc.update("UPDATE transactions SET notified = 1 WHERE tx_hash = ?", txHash) > 0;
    }

    public List<Transaction> querySales(int limit) {
        return queryNewest(SALE_TYPES, limit);
    }

    public List<Transaction> queryListings(int limit) {
        return queryNewest(LISTING_TYPES, limit);
    }

    public MarketFeed queryCombined(int limit) {
        return new MarketFeed(querySales(limit), queryListings(limit));
    }

    /** Sales with block time inside the retention window. */
    public long getTotalSales() {
        return countSince(SALE_TYPES);
    }

    /** Listings with block time inside the retention window. */
    public long getTotalListings() {
        return countSince(LISTING_TYPES);
    }

    /**
     * Deletes rows whose block time is older than the retention window. Returns the number deleted.
     */
    public int purgeOld() {
        requireInitialized();
        int deleted = jdbc.update("DELETE FROM transactions WHERE block_time < ?", retentionCutoff());
        if (deleted > 0) {
            log.info("Purged {} transactions older than {} days", deleted, properties.getRetentionDays());
        }
        return deleted;
    }

    public StoreStats getStats() {
        requireInitialized();
        return jdbc.queryForObject("SELECT COUNT(*) AS total, "
                        + "SUM(CASE WHEN type IN " + SALE_TYPES + " THEN 1 ELSE 0 END) AS sales, "
                        + "SUM(CASE WHEN type IN " + LISTING_TYPES + " THEN 1 ELSE 0 END) AS listings, "
                        + "MIN(block_time) AS oldest FROM transactions",
                (rs, rowNum) -> {
                    long oldest = rs.getLong("oldest");
                    Long oldestOrNull = rs.wasNull() ? null : oldest;
                    return new StoreStats(rs.getLong("total"), rs.getLong("sales"), rs.getLong("listings"), oldestOrNull);
                });
    }

    private List<Transaction> queryNewest(String types, int limit) {
        requireInitialized();
        if (limit <= 0) {
            return List.of();
        }
        List<Transaction> newestFirst = jdbc.query(
                "SELECT * FROM transactions WHERE type IN " + types
                        + " ORDER BY block_time DESC, block_index DESC LIMIT ?",
                TransactionRowMapper.INSTANCE, limit);
        List<Transaction> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }

    private long countSince(String types) {
        requireInitialized();
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM transactions WHERE type IN " + types + " AND block_time >= ?",
                Long.class, retentionCutoff());
        return count == null ? 0L : count;
    }

    private long retentionCutoff() {
        return clock.instant().minus(Duration.ofDays(properties.getRetentionDays())).getEpochSecond();
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new StoreNotInitializedException();
        }
    }

    private static String inList(Set<TransactionType> types) {
        return types.stream()
                .map(t -> "'" + t.name() + "'")
                .sorted()
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
