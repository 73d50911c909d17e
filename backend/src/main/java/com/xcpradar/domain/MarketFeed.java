package com.xcpradar.domain;

import java.util.List;

/**
 * Recent sales and listings, each oldest-first.
 */
public record MarketFeed(List<Transaction> sales, List<Transaction> listings) {
}
