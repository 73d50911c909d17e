package com.xcpradar.ingestion.store.migration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Comparator;
import java.util.List;

/**
 * Brings the store schema to the latest version. The current version lives in the single-row
 * schema_version table (0 when absent). Each pending step runs in its own transaction with the version bump.
 */
@Slf4j
@Component
public class SchemaMigrator {

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final List<SchemaMigration> migrations;

    @Autowired
    public SchemaMigrator(JdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this(jdbc, transactionTemplate, defaultMigrations());
    }

    SchemaMigrator(JdbcTemplate jdbc, TransactionTemplate transactionTemplate, List<SchemaMigration> migrations) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.migrations = migrations.stream()
                .sorted(Comparator.comparingInt(SchemaMigration::version))
                .toList();
    }

    public static List<SchemaMigration> defaultMigrations() {
        return List.of(new V1CreateTransactionsTable(), new V2WidenTransactionTypes(), new V3AddQueryIndexes());
    }

    public int latestVersion() {
        return migrations.isEmpty() ? 0 : migrations.get(migrations.size() - 1).version();
    }

    /**
     * Applies every migration above the stored version. Returns the resulting version.
     */
    public int migrate() {
        ensureVersionTable();
        int current = currentVersion();
        for (SchemaMigration migration : migrations) {
            if (migration.version() <= current) {
                continue;
            }
            log.info("Applying store migration V{}: {}", migration.version(), migration.description());
            transactionTemplate.executeWithoutResult(status -> {
                migration.apply(jdbc);
                jdbc.update("UPDATE schema_version SET version = ? WHERE id = 1", migration.version());
            });
            current = migration.version();
        }
        return current;
    }

    public int currentVersion() {
        Integer version = jdbc.queryForObject("SELECT version FROM schema_version WHERE id = 1", Integer.class);
        return version == null ? 0 : version;
    }

    private void ensureVersionTable() {
        jdbc.execute("CREATE TABLE IF NOT EXISTS schema_version (id INTEGER PRIMARY KEY CHECK (id = 1), version INTEGER NOT NULL)");
        jdbc.update("INSERT OR IGNORE INTO schema_version (id, version) VALUES (1, 0)");
    }
}
