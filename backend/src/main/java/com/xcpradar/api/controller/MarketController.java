package com.xcpradar.api.controller;

import com.xcpradar.api.dto.DispenserListingResponse;
import com.xcpradar.api.dto.MarketFeedResponse;
import com.xcpradar.api.dto.MarketStatsResponse;
import com.xcpradar.api.dto.TransactionResponse;
import com.xcpradar.domain.MarketFeed;
import com.xcpradar.domain.StoreStats;
import com.xcpradar.domain.Transaction;
import com.xcpradar.ingestion.dispenser.DispenserQueryService;
import com.xcpradar.ingestion.history.MarketHistoryQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Market history (from the transaction store) and live dispenser snapshots (from the ledger).
 * History windows are returned oldest-first.
 */
@RestController
@RequestMapping("/api/v1/market")
@RequiredArgsConstructor
public class MarketController {

    private final MarketHistoryQueryService marketHistoryQueryService;
    private final DispenserQueryService dispenserQueryService;

    @GetMapping("/sales")
    public ResponseEntity<List<TransactionResponse>> getSales(
            @RequestParam(required = false, defaultValue = "10") int limit
    ) {
        return ResponseEntity.ok(toResponses(marketHistoryQueryService.recentSales(limit)));
    }

    @GetMapping("/listings")
    public ResponseEntity<List<TransactionResponse>> getListings(
            @RequestParam(required = false, defaultValue = "10") int limit
    ) {
        return ResponseEntity.ok(toResponses(marketHistoryQueryService.recentListings(limit)));
    }

    @GetMapping("/recent")
    public ResponseEntity<MarketFeedResponse> getRecent(
            @RequestParam(required = false, defaultValue = "10") int limit
    ) {
        MarketFeed feed = marketHistoryQueryService.recent(limit);
        return ResponseEntity.ok(new MarketFeedResponse(toResponses(feed.sales()), toResponses(feed.listings())));
    }

    @GetMapping("/stats")
    public ResponseEntity<MarketStatsResponse> getStats() {
        MarketHistoryQueryService.MarketSummary summary = marketHistoryQueryService.summary();
        StoreStats stats = summary.stats();
        return ResponseEntity.ok(new MarketStatsResponse(
                stats.totalTransactions(),
                stats.sales(),
                stats.listings(),
                summary.salesLast30Days(),
                summary.listingsLast30Days(),
                stats.oldestTimestamp() == null ? null : Instant.ofEpochSecond(stats.oldestTimestamp())
        ));
    }

    @GetMapping("/dispensers/{asset}")
    public ResponseEntity<List<DispenserListingResponse>> getActiveDispensers(
            @PathVariable String asset,
            @RequestParam(required = false, defaultValue = "10") int limit
    ) {
        return ResponseEntity.ok(dispenserQueryService.getActiveDispensersForAsset(asset, limit).stream()
                .map(DispenserListingResponse::from)
                .toList());
    }

    private static List<TransactionResponse> toResponses(List<Transaction> transactions) {
        return transactions.stream().map(TransactionResponse::from).toList();
    }
}
