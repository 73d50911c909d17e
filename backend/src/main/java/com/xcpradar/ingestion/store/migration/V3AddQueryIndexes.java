package com.xcpradar.ingestion.store.migration;

import org.springframework.jdbc.core.JdbcTemplate;

public class V3AddQueryIndexes implements SchemaMigration {

    @Override
    public int version() {
        return 3;
    }

    @Override
    public String description() {
        return "add recency, type and pending-notification indexes";
    }

    @Override
    public void apply(JdbcTemplate jdbc) {
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_transactions_block_time ON transactions (block_time DESC)");
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_transactions_type_block_time ON transactions (type, block_time DESC, block_index DESC)");
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_transactions_pending ON transactions (notified) WHERE notified = 0");
    }
}
