package com.xcpradar.ingestion.store.migration;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Splits SALE/LISTING into dispenser and DEX variants. SQLite cannot alter a CHECK constraint,
 * so the table is rebuilt and legacy rows are rewritten to their dispenser equivalents.
 */
public class V2WidenTransactionTypes implements SchemaMigration {

    @Override
    public int version() {
        return 2;
    }

    @Override
    public String description() {
        return "widen transaction type to DIS_SALE, DIS_LISTING, DEX_SALE, DEX_LISTING";
    }

    @Override
    public void apply(JdbcTemplate jdbc) {
        jdbc.execute("DROP TABLE IF EXISTS transactions_v2");
        jdbc.execute("""
                CREATE TABLE transactions_v2 (
                    tx_hash       TEXT PRIMARY KEY,
                    type          TEXT NOT NULL CHECK (type IN ('DIS_SALE', 'DIS_LISTING', 'DEX_SALE', 'DEX_LISTING')),
                    asset         TEXT NOT NULL,
                    amount        INTEGER NOT NULL CHECK (amount > 0),
                    price         INTEGER NOT NULL CHECK (price >= 0),
                    payment_asset TEXT NOT NULL,
                    block_time    INTEGER NOT NULL,
                    block_index   INTEGER NOT NULL CHECK (block_index > 0),
                    notified      INTEGER NOT NULL DEFAULT 0 CHECK (notified IN (0, 1)),
                    created_at    INTEGER NOT NULL
                )
                """);
        jdbc.execute("""
                INSERT INTO transactions_v2 (tx_hash, type, asset, amount, price, payment_asset,
                                             block_time, block_index, notified, created_at)
                SELECT tx_hash,
                       CASE type WHEN 'SALE' THEN 'DIS_SALE' WHEN 'LISTING' THEN 'DIS_LISTING' ELSE type END,
                       asset, amount, price, payment_asset, block_time, block_index, notified, created_at
                FROM transactions
                """);
        jdbc.execute("DROP TABLE transactions");
        jdbc.execute("ALTER TABLE transactions_v2 RENAME TO transactions");
    }
}
