package com.xcpradar.ingestion.job;

/**
 * Thrown when the monitor cannot read the ledger height within its startup retry budget.
 */
public class MonitorStartupException extends RuntimeException {

    public MonitorStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
