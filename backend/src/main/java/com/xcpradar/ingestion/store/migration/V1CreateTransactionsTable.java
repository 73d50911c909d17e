package com.xcpradar.ingestion.store.migration;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Initial layout: dispenser activity only, typed SALE or LISTING. Kept as-is so existing databases
 * created before DEX support migrate through the same path as fresh ones.
 */
public class V1CreateTransactionsTable implements SchemaMigration {

    @Override
    public int version() {
        return 1;
    }

    @Override
    public String description() {
        return "create transactions table";
    }

    @Override
    public void apply(JdbcTemplate jdbc) {
        jdbc.execute("""
                CREATE TABLE IF NOT EXISTS transactions (
                    tx_hash       TEXT PRIMARY KEY,
                    type          TEXT NOT NULL CHECK (type IN ('SALE', 'LISTING')),
                    asset         TEXT NOT NULL,
                    amount        INTEGER NOT NULL,
                    price         INTEGER NOT NULL,
                    payment_asset TEXT NOT NULL,
                    block_time    INTEGER NOT NULL,
                    block_index   INTEGER NOT NULL,
                    notified      INTEGER NOT NULL DEFAULT 0,
                    created_at    INTEGER NOT NULL
                )
                """);
    }
}
