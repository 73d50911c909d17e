package com.xcpradar.ingestion.adapter;

/**
 * Thrown when a ledger indexer call fails (HTTP, transport, or malformed payload) after retries.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
