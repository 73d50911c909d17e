package com.xcpradar.ingestion.adapter;

import java.util.List;

/**
 * Read-only access to the Counterparty indexer. All calls block the calling thread and throw
 * {@link LedgerException} once retries are exhausted.
 */
public interface LedgerClient {

    /**
     * Latest block height known to the indexer.
     */
    long currentHeight();

    /**
     * Dispenser sales with block index >= sinceBlock, across as many pages as needed.
     */
    List<DispenseEvent> listSales(long sinceBlock);

    /**
     * Dispenser listings with block index >= sinceBlock; when sinceBlock is null, every currently open dispenser.
     */
    List<DispenserEvent> listListings(Long sinceBlock);

    /**
     * Every dispenser (open or closed) for one asset.
     */
    List<DispenserEvent> listListingsForAsset(String asset);

    /**
     * DEX order matches with block index >= sinceBlock.
     */
    List<OrderMatchEvent> listOrderMatches(long sinceBlock);

    /**
     * DEX orders opened at block index >= sinceBlock.
     */
    List<OrderEvent> listOrders(long sinceBlock);
}
