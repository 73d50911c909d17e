package com.xcpradar.ingestion.store.migration;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * One forward-only step of the transaction store schema. Applied inside a database transaction
 * together with the schema_version bump, so a failed step leaves the previous version intact.
 */
public interface SchemaMigration {

    /** Target version after this step; versions are contiguous starting at 1. */
    int version();

    String description();

    void apply(JdbcTemplate jdbc);
}
