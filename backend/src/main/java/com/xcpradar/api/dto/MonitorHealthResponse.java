package com.xcpradar.api.dto;

import java.time.Instant;

public record MonitorHealthResponse(
        String state,
        boolean running,
        long currentBlockCursor,
        Instant lastPollTime,
        Instant lastTransactionTime,
        long pollIntervalSeconds,
        long completedCycles,
        long failedCycles,
        boolean storeInitialized
) {
}
