package com.xcpradar.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Market event category. Dispenser (DIS) events come from vending-style escrows, DEX events from order matching.
 */
public enum TransactionType {
    DIS_SALE(Venue.DISPENSER, Side.SALE),
    DIS_LISTING(Venue.DISPENSER, Side.LISTING),
    DEX_SALE(Venue.DEX, Side.SALE),
    DEX_LISTING(Venue.DEX, Side.LISTING);

    public static final Set<TransactionType> SALES = EnumSet.of(DIS_SALE, DEX_SALE);
    public static final Set<TransactionType> LISTINGS = EnumSet.of(DIS_LISTING, DEX_LISTING);

    private final Venue venue;
    private final Side side;

    TransactionType(Venue venue, Side side) {
        this.venue = venue;
        this.side = side;
    }

    public Venue getVenue() {
        return venue;
    }

    public boolean isSale() {
        return side == Side.SALE;
    }

    public boolean isListing() {
        return side == Side.LISTING;
    }

    public enum Venue {
        DISPENSER,
        DEX
    }

    private enum Side {
        SALE,
        LISTING
    }
}
