package com.xcpradar.domain;

/**
 * Point-in-time view of one open dispenser. Never persisted.
 *
 * @param pricePerUnit satoshis per dispense lot
 */
public record DispenserListing(
        String source,
        long escrowQuantity,
        long giveQuantity,
        long giveRemaining,
        long pricePerUnit,
        String txHash,
        long blockIndex
) {
}
