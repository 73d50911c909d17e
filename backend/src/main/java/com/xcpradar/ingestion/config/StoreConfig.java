package com.xcpradar.ingestion.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SQLite file under xcpradar.store.path, behind a single-connection Hikari pool.
 * One connection serializes writers, which SQLite requires anyway.
 */
@Slf4j
@Configuration
public class StoreConfig {

    public static final String DATABASE_FILE = "transactions.db";
    private static final int BUSY_TIMEOUT_MS = 5_000;

    @Bean(destroyMethod = "close")
    public HikariDataSource transactionStoreDataSource(StoreProperties properties) {
        return createDataSource(Path.of(properties.getPath()));
    }

    /**
     * Builds the pooled SQLite data source for a store directory, creating the directory when missing.
     */
    public static HikariDataSource createDataSource(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create store directory " + directory, e);
        }
        Path file = directory.resolve(DATABASE_FILE);
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        SQLiteDataSource sqliteDataSource = new SQLiteDataSource(sqlite);
        sqliteDataSource.setUrl("jdbc:sqlite:" + file.toAbsolutePath());

        HikariConfig hikari = new HikariConfig();
        hikari.setDataSource(sqliteDataSource);
        hikari.setMaximumPoolSize(1);
        hikari.setPoolName("transaction-store");
        log.info("Transaction store database at {}", file.toAbsolutePath());
        return new HikariDataSource(hikari);
    }
}
