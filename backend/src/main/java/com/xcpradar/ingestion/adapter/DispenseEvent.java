package com.xcpradar.ingestion.adapter;

import java.util.List;

/**
 * Purchase against a dispenser. Carries no price: the price lives on the originating dispenser.
 */
public record DispenseEvent(
        String txHash,
        String status,
        String asset,
        long quantity,
        long blockIndex,
        long timestamp,
        String dispenserTxHash
) implements LedgerEvent {

    public static final String STATUS_VALID = "valid";

    @Override
    public boolean isFinal() {
        return STATUS_VALID.equals(status);
    }

    @Override
    public List<String> assets() {
        return List.of(asset);
    }
}
