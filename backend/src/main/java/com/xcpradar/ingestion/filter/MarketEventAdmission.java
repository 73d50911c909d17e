package com.xcpradar.ingestion.filter;

import com.xcpradar.ingestion.adapter.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Admission gate applied to every fetched event before dedup and classification: the status must be
 * final (sales) or open (listings), and at least one touched asset must pass the {@link AssetAdmissionFilter}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketEventAdmission {

    private final AssetAdmissionFilter assetFilter;

    public boolean admits(LedgerEvent event) {
        if (event == null || event.txHash() == null || event.txHash().isBlank()) {
            return false;
        }
        if (!event.isFinal()) {
            log.debug("Skipping {} {}: status {}", event.getClass().getSimpleName(), event.txHash(), event.status());
            return false;
        }
        if (event.assets().stream().noneMatch(assetFilter::admits)) {
            log.debug("Skipping {} {}: asset not admitted {}", event.getClass().getSimpleName(), event.txHash(), event.assets());
            return false;
        }
        return true;
    }
}
