package com.xcpradar.api.controller;

import com.xcpradar.api.dto.MonitorHealthResponse;
import com.xcpradar.ingestion.history.MarketHistoryQueryService;
import com.xcpradar.ingestion.job.MonitorHealth;
import com.xcpradar.ingestion.job.TransactionMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/monitor")
@RequiredArgsConstructor
public class MonitorController {

    private final TransactionMonitor transactionMonitor;
    private final MarketHistoryQueryService marketHistoryQueryService;

    @GetMapping("/health")
    public ResponseEntity<MonitorHealthResponse> getHealth() {
        MonitorHealth health = transactionMonitor.getHealthStatus();
        return ResponseEntity.ok(new MonitorHealthResponse(
                health.state().name(),
                health.isRunning(),
                health.currentBlockCursor(),
                health.lastPollTime(),
                health.lastTransactionTime(),
                health.pollIntervalSeconds(),
                health.completedCycles(),
                health.failedCycles(),
                marketHistoryQueryService.isStoreReady()
        ));
    }
}
