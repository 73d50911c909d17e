package com.xcpradar.ingestion.adapter;

import java.util.List;

/**
 * DEX order match (atomic swap). Which side is the collectible is decided during classification.
 */
public record OrderMatchEvent(
        String txHash,
        String status,
        String forwardAsset,
        long forwardQuantity,
        String backwardAsset,
        long backwardQuantity,
        long blockIndex,
        long timestamp
) implements LedgerEvent {

    public static final String STATUS_COMPLETED = "completed";

    @Override
    public boolean isFinal() {
        return STATUS_COMPLETED.equals(status);
    }

    @Override
    public List<String> assets() {
        return List.of(forwardAsset, backwardAsset);
    }
}
