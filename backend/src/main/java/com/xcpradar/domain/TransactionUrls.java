package com.xcpradar.domain;

/**
 * Explorer links for stored transactions. Links are always derived here and never persisted.
 */
public final class TransactionUrls {

    private TransactionUrls() {
    }

    public static String tokenScan(String txHash) {
        return "https://cp20.tokenscan.io/tx/" + txHash;
    }

    public static String xchain(String txHash) {
        return "https://xchain.io/tx/" + txHash;
    }

    public static String horizonTx(String txHash) {
        return "https://horizon.market/explorer/tx/" + txHash;
    }

    /**
     * Horizon Market asset page filtered to the listing venue (dispenser vs swap) and quote asset.
     */
    public static String horizonAsset(String asset, String paymentAsset, TransactionType type) {
        String listingType = type == TransactionType.DIS_LISTING ? "dispenser" : "swap";
        return "https://horizon.market/assets/" + asset
                + "?from=1M&quote_asset=" + paymentAsset
                + "&tab=buy&type=" + listingType;
    }
}
