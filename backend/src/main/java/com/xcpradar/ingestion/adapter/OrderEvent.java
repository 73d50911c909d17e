package com.xcpradar.ingestion.adapter;

import java.util.List;

/**
 * Open DEX order offering {@code giveQuantity} of {@code giveAsset} for {@code getQuantity} of {@code getAsset}.
 */
public record OrderEvent(
        String txHash,
        String status,
        String giveAsset,
        long giveQuantity,
        String getAsset,
        long getQuantity,
        long blockIndex,
        long timestamp
) implements LedgerEvent {

    public static final String STATUS_OPEN = "open";

    @Override
    public boolean isFinal() {
        return STATUS_OPEN.equals(status);
    }

    @Override
    public List<String> assets() {
        return List.of(giveAsset, getAsset);
    }
}
