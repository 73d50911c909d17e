package com.xcpradar.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Ledger-confirmed market event as stored in the transactions table.
 * Every field is fixed at ingestion except {@code notified}, which flips once after delivery.
 * Prices are integers in the payment asset's smallest unit (10^-8).
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString
public class Transaction {

    @EqualsAndHashCode.Include
    private final String txHash;
    private final TransactionType type;
    private final String asset;
    private final long amount;
    private final long price;
    private final String paymentAsset;
    /** Block time, unix seconds. */
    private final long timestamp;
    private final long blockIndex;
    @Setter
    private boolean notified;
    /** Ingestion time, unix seconds. */
    private final long createdAt;

    public boolean isSale() {
        return type != null && type.isSale();
    }

    public String tokenScanUrl() {
        return TransactionUrls.tokenScan(txHash);
    }

    public String xchainUrl() {
        return TransactionUrls.xchain(txHash);
    }
}
