package com.xcpradar.ingestion.dispenser;

import com.xcpradar.domain.DispenserListing;
import com.xcpradar.ingestion.adapter.DispenserEvent;
import com.xcpradar.ingestion.adapter.LedgerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Live snapshot of open dispensers for one asset, straight from the ledger. Nothing is stored or cached;
 * ledger failures propagate to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispenserQueryService {

    public static final int DEFAULT_LIMIT = 10;

    private final LedgerClient ledgerClient;

    public List<DispenserListing> getActiveDispensersForAsset(String asset) {
        return getActiveDispensersForAsset(asset, DEFAULT_LIMIT);
    }

    /**
     * Open dispensers with stock left, cheapest unit price first, at most {@code limit}.
     */
    public List<DispenserListing> getActiveDispensersForAsset(String asset, int limit) {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("asset must not be blank");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        List<DispenserEvent> all = ledgerClient.listListingsForAsset(asset.strip());
        List<DispenserListing> active = all.stream()
                .filter(d -> DispenserEvent.STATUS_OPEN.equals(d.status()))
                .filter(d -> d.giveRemaining() > 0)
                .sorted(Comparator.comparingLong(DispenserEvent::satoshiRate))
                .limit(limit)
                .map(DispenserQueryService::toListing)
                .toList();
        log.debug("Dispensers for {}: {} active of {}", asset, active.size(), all.size());
        return active;
    }

    private static DispenserListing toListing(DispenserEvent d) {
        return new DispenserListing(
                d.source(),
                d.escrowQuantity(),
                d.giveQuantity(),
                d.giveRemaining(),
                d.satoshiRate(),
                d.txHash(),
                d.blockIndex());
    }
}
