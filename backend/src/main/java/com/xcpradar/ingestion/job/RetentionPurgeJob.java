package com.xcpradar.ingestion.job;

import com.xcpradar.ingestion.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic retention purge. The first purge happens in {@link TransactionStore#initialize()}, so this job waits one interval.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionPurgeJob {

    private final TransactionStore store;

    @Scheduled(
            fixedRateString = "${xcpradar.store.purge-interval-ms:86400000}",
            initialDelayString = "${xcpradar.store.purge-interval-ms:86400000}")
    public void runScheduled() {
        if (!store.isInitialized()) {
            log.debug("Skipping retention purge: store not initialized");
            return;
        }
        try {
            int deleted = store.purgeOld();
            log.info("Scheduled retention purge removed {} transactions", deleted);
        } catch (RuntimeException e) {
            log.error("Scheduled retention purge failed", e);
        }
    }
}
