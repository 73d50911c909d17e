package com.xcpradar.ingestion.adapter;

import java.util.List;

/**
 * Market event as reported by the ledger indexer. One implementation per category:
 * {@link DispenseEvent}, {@link DispenserEvent}, {@link OrderMatchEvent}, {@link OrderEvent}.
 */
public interface LedgerEvent {

    String txHash();

    String status();

    long blockIndex();

    /** Block time in unix seconds; 0 when the indexer did not report it. */
    long timestamp();

    /** Whether the status marks the event as confirmed (sales) or still open (listings). */
    boolean isFinal();

    /** Every asset the event touches; used by asset admission. */
    List<String> assets();
}
