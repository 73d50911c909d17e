package com.xcpradar.ingestion.job;

/**
 * Outcome of one successful poll cycle.
 *
 * @param fromBlock    cursor the cycle started from
 * @param nextCursor   cursor after the cycle
 * @param eventsFetched events returned by the ledger across all categories, before admission
 * @param salesStored  sale rows newly written
 * @param listingsStored listing rows newly written
 */
public record PollCycleResult(long fromBlock, long nextCursor, int eventsFetched, int salesStored, int listingsStored) {

    public int stored() {
        return salesStored + listingsStored;
    }
}
