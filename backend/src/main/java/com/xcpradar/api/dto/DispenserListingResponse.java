package com.xcpradar.api.dto;

import com.xcpradar.domain.DispenserListing;
import com.xcpradar.notification.NotificationFormatter;

public record DispenserListingResponse(
        String source,
        long escrowQuantity,
        long giveQuantity,
        long giveRemaining,
        long pricePerUnit,
        String pricePerUnitBtc,
        String txHash,
        long blockIndex
) {

    public static DispenserListingResponse from(DispenserListing listing) {
        return new DispenserListingResponse(
                listing.source(),
                listing.escrowQuantity(),
                listing.giveQuantity(),
                listing.giveRemaining(),
                listing.pricePerUnit(),
                NotificationFormatter.formatPrice(listing.pricePerUnit()),
                listing.txHash(),
                listing.blockIndex()
        );
    }
}
