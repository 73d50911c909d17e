package com.xcpradar.ingestion.adapter;

import java.util.List;

/**
 * Dispenser opened or reported by an asset lookup. {@code satoshiRate} is the BTC price per dispense lot.
 */
public record DispenserEvent(
        String txHash,
        String status,
        String asset,
        long giveQuantity,
        long giveRemaining,
        long satoshiRate,
        long blockIndex,
        long timestamp,
        String source,
        long escrowQuantity
) implements LedgerEvent {

    public static final String STATUS_OPEN = "open";
    public static final String STATUS_CLOSED = "closed";

    @Override
    public boolean isFinal() {
        return STATUS_OPEN.equals(status);
    }

    @Override
    public List<String> assets() {
        return List.of(asset);
    }
}
