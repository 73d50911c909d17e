package com.xcpradar.api.dto;

import com.xcpradar.domain.Transaction;
import com.xcpradar.domain.TransactionType;
import com.xcpradar.domain.TransactionUrls;
import com.xcpradar.notification.NotificationFormatter;

import java.time.Instant;

/**
 * Stored market transaction. {@code price} is in smallest units; {@code priceDisplay} is the decimal form.
 */
public record TransactionResponse(
        String txHash,
        TransactionType type,
        String asset,
        long amount,
        long price,
        String priceDisplay,
        String paymentAsset,
        Instant blockTime,
        long blockIndex,
        boolean notified,
        String tokenScanUrl,
        String xchainUrl,
        String horizonUrl
) {

    public static TransactionResponse from(Transaction tx) {
        String horizon = tx.isSale()
                ? TransactionUrls.horizonTx(tx.getTxHash())
                : TransactionUrls.horizonAsset(tx.getAsset(), tx.getPaymentAsset(), tx.getType());
        return new TransactionResponse(
                tx.getTxHash(),
                tx.getType(),
                tx.getAsset(),
                tx.getAmount(),
                tx.getPrice(),
                NotificationFormatter.formatPrice(tx.getPrice()),
                tx.getPaymentAsset(),
                Instant.ofEpochSecond(tx.getTimestamp()),
                tx.getBlockIndex(),
                tx.isNotified(),
                tx.tokenScanUrl(),
                tx.xchainUrl(),
                horizon
        );
    }
}
