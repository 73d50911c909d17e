package com.xcpradar.ingestion.job;

import java.time.Instant;

/**
 * Point-in-time view of the monitor. Times are null until the first poll / first stored transaction.
 */
public record MonitorHealth(
        MonitorState state,
        long currentBlockCursor,
        Instant lastPollTime,
        Instant lastTransactionTime,
        long pollIntervalSeconds,
        long completedCycles,
        long failedCycles
) {

    public boolean isRunning() {
        return state == MonitorState.RUNNING;
    }
}
