package com.xcpradar.ingestion.store;

import com.xcpradar.domain.MarketFeed;
import com.xcpradar.domain.StoreStats;
import com.xcpradar.domain.Transaction;
import com.xcpradar.domain.TransactionType;
import com.xcpradar.ingestion.config.StoreConfig;
import com.xcpradar.ingestion.config.StoreProperties;
import com.xcpradar.ingestion.store.migration.SchemaMigrator;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path dir;

    private HikariDataSource dataSource;
    private JdbcTemplate jdbc;
    private TransactionStore store;

    @BeforeEach
    void setUp() {
        dataSource = StoreConfig.createDataSource(dir);
        jdbc = new JdbcTemplate(dataSource);
        TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        store = new TransactionStore(jdbc, new SchemaMigrator(jdbc, tx), new StoreProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Test
    @DisplayName("operations before initialize fail with StoreNotInitializedException")
    void requiresInitialize() {
        assertThat(store.isInitialized()).isFalse();
        assertThatThrownBy(() -> store.exists("abc")).isInstanceOf(StoreNotInitializedException.class);
        assertThatThrownBy(() -> store.insert(sale("abc", 1_000, NOW))).isInstanceOf(StoreNotInitializedException.class);
        assertThatThrownBy(() -> store.querySales(3)).isInstanceOf(StoreNotInitializedException.class);
        assertThatThrownBy(() -> store.getStats()).isInstanceOf(StoreNotInitializedException.class);
    }

    @Test
    @DisplayName("insert is idempotent on tx hash: second insert returns false and leaves one row")
    void insertIdempotent() {
        store.initialize();
        Transaction t = sale("aa01", 1_000, NOW.minusSeconds(60));

        assertThat(store.insert(t)).isTrue();
        assertThat(store.insert(t.toBuilder().price(999).build())).isFalse();

        assertThat(store.exists("aa01")).isTrue();
        assertThat(store.getStats().totalTransactions()).isEqualTo(1);
        assertThat(store.querySales(10)).singleElement()
                .satisfies(stored -> assertThat(stored.getPrice()).isEqualTo(t.getPrice()));
    }

    @Test
    @DisplayName("exists is false for unknown hash")
    void existsUnknown() {
        store.initialize();
        assertThat(store.exists("missing")).isFalse();
    }

    @Test
    @DisplayName("markNotified flips the flag once; unknown hash is a no-op")
    void markNotified() {
        store.initialize();
        store.insert(sale("aa02", 1_000, NOW.minusSeconds(60)));

        assertThat(store.querySales(1).get(0).isNotified()).isFalse();
        assertThat(store.markNotified("aa02")).isTrue();
        assertThat(store.markNotified("aa02")).isTrue();
        assertThat(store.markNotified("nope")).isFalse();
        assertThat(store.querySales(1).get(0).isNotified()).isTrue();
    }

    @Test
    @DisplayName("querySales(3) returns the newest three sales, oldest first")
    void querySalesWindow() {
        store.initialize();
        for (int i = 1; i <= 5; i++) {
            store.insert(sale("s" + i, 900_000 + i, NOW.minus(Duration.ofMinutes(10 - i))));
        }
        store.insert(listing("l1", 900_010, NOW));

        List<Transaction> sales = store.querySales(3);

        assertThat(sales).extracting(Transaction::getTxHash).containsExactly("s3", "s4", "s5");
        assertThat(sales).allMatch(Transaction::isSale);
    }

    @Test
    @DisplayName("same block time is ordered by block index")
    void tieBreaksOnBlockIndex() {
        store.initialize();
        Instant t = NOW.minusSeconds(30);
        store.insert(listing("b", 101, t));
        store.insert(listing("a", 100, t));
        store.insert(listing("c", 102, t));

        assertThat(store.queryListings(10)).extracting(Transaction::getTxHash).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("queryCombined returns both windows and separates DIS and DEX types correctly")
    void queryCombined() {
        store.initialize();
        store.insert(sale("s1", 10, NOW.minusSeconds(50)));
        store.insert(sale("s2", 11, NOW.minusSeconds(40)).toBuilder().type(TransactionType.DEX_SALE).paymentAsset("XCP").build());
        store.insert(listing("l1", 12, NOW.minusSeconds(30)));
        store.insert(listing("l2", 13, NOW.minusSeconds(20)).toBuilder().type(TransactionType.DEX_LISTING).build());

        MarketFeed feed = store.queryCombined(5);

        assertThat(feed.sales()).extracting(Transaction::getType)
                .containsExactly(TransactionType.DIS_SALE, TransactionType.DEX_SALE);
        assertThat(feed.listings()).extracting(Transaction::getType)
                .containsExactly(TransactionType.DIS_LISTING, TransactionType.DEX_LISTING);
    }

    @Test
    @DisplayName("purgeOld removes a 31-day-old row and keeps a 29-day-old row")
    void purgeRetention() {
        store.initialize();
        store.insert(sale("old", 1, NOW.minus(Duration.ofDays(31))));
        store.insert(sale("recent", 2, NOW.minus(Duration.ofDays(29))));

        assertThat(store.purgeOld()).isEqualTo(1);

        assertThat(store.exists("old")).isFalse();
        assertThat(store.exists("recent")).isTrue();
    }

    @Test
    @DisplayName("initialize purges rows already past retention")
    void initializePurges() {
        store.initialize();
        store.insert(sale("old", 1, NOW.minus(Duration.ofDays(40))));

        store.initialize();

        assertThat(store.exists("old")).isFalse();
    }

    @Test
    @DisplayName("totals count only the retention window; stats cover the whole table")
    void totalsAndStats() {
        store.initialize();
        store.insert(sale("s1", 1, NOW.minus(Duration.ofDays(2))));
        store.insert(sale("s2", 2, NOW.minus(Duration.ofDays(1))));
        store.insert(listing("l1", 3, NOW.minus(Duration.ofHours(1))));

        assertThat(store.getTotalSales()).isEqualTo(2);
        assertThat(store.getTotalListings()).isEqualTo(1);
        StoreStats stats = store.getStats();
        assertThat(stats.totalTransactions()).isEqualTo(3);
        assertThat(stats.sales()).isEqualTo(2);
        assertThat(stats.listings()).isEqualTo(1);
        assertThat(stats.oldestTimestamp()).isEqualTo(NOW.minus(Duration.ofDays(2)).getEpochSecond());
    }

    @Test
    @DisplayName("stats on an empty store have no oldest timestamp")
    void emptyStats() {
        store.initialize();
        StoreStats stats = store.getStats();
        assertThat(stats.totalTransactions()).isZero();
        assertThat(stats.oldestTimestamp()).isNull();
    }

    @Test
    @DisplayName("rows survive reopening the database file")
    void durableAcrossReopen() {
        store.initialize();
        store.insert(sale("keep", 5, NOW.minusSeconds(5)));
        dataSource.close();

        dataSource = StoreConfig.createDataSource(dir);
        jdbc = new JdbcTemplate(dataSource);
        TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        TransactionStore reopened = new TransactionStore(jdbc, new SchemaMigrator(jdbc, tx), new StoreProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        reopened.initialize();

        assertThat(reopened.exists("keep")).isTrue();
    }

    private static Transaction sale(String hash, long block, Instant time) {
        return Transaction.builder()
                .txHash(hash)
                .type(TransactionType.DIS_SALE)
                .asset("FAKEASF")
                .amount(1)
                .price(150_000_000L)
                .paymentAsset("BTC")
                .timestamp(time.getEpochSecond())
                .blockIndex(block)
                .createdAt(NOW.getEpochSecond())
                .build();
    }

    private static Transaction listing(String hash, long block, Instant time) {
        return Transaction.builder()
                .txHash(hash)
                .type(TransactionType.DIS_LISTING)
                .asset("PEPEFAKE")
                .amount(3)
                .price(200_000L)
                .paymentAsset("BTC")
                .timestamp(time.getEpochSecond())
                .blockIndex(block)
                .createdAt(NOW.getEpochSecond())
                .build();
    }
}
