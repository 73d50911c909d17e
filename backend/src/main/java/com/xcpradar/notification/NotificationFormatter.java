package com.xcpradar.notification;

import com.xcpradar.domain.Transaction;
import com.xcpradar.domain.TransactionType;
import com.xcpradar.domain.TransactionUrls;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders the Telegram Markdown text for a transaction.
 * <pre>
 * 💰 SOLD: FAKEASF x1 | Paid: 0.0015 BTC
 * Jan 05 14:30 | Block 870,123 | 🔗 [TokenScan](https://cp20.tokenscan.io/tx/...) 🎰
 *
 * 📋 LISTING: FAKEASF | Qty: 3 | Price: 0.002 BTC
 * Jan 05 14:30 | Block 870,123 | 🔗 [Horizon](https://horizon.market/assets/FAKEASF?...) 🎰
 * </pre>
 */
@Component
public class NotificationFormatter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("MMM dd HH:mm", Locale.US)
            .withZone(ZoneOffset.UTC);
    private static final int PRICE_DECIMALS = 8;

    public String format(Transaction tx) {
        return tx.isSale() ? formatSale(tx) : formatListing(tx);
    }

    String formatSale(Transaction tx) {
        String icon = tx.getType() == TransactionType.DIS_SALE ? "💰" : "⚡";
        return icon + " SOLD: " + tx.getAsset() + " x" + grouped(tx.getAmount())
                + " | Paid: " + formatPrice(tx.getPrice()) + " " + tx.getPaymentAsset() + "\n"
                + formatTimestamp(tx.getTimestamp()) + " | Block " + grouped(tx.getBlockIndex())
                + " | 🔗 [TokenScan](" + tx.tokenScanUrl() + ") " + venueIcon(tx.getType());
    }

    String formatListing(Transaction tx) {
        String icon = tx.getType() == TransactionType.DIS_LISTING ? "📋" : "🔄";
        String horizon = TransactionUrls.horizonAsset(tx.getAsset(), tx.getPaymentAsset(), tx.getType());
        return icon + " LISTING: " + tx.getAsset() + " | Qty: " + grouped(tx.getAmount())
                + " | Price: " + formatPrice(tx.getPrice()) + " " + tx.getPaymentAsset() + "\n"
                + formatTimestamp(tx.getTimestamp()) + " | Block " + grouped(tx.getBlockIndex())
                + " | 🔗 [Horizon](" + horizon + ") " + venueIcon(tx.getType());
    }

    /**
     * Smallest-unit integer to decimal with trailing zeros removed: 150000000 → "1.5", 0 → "0".
     */
    public static String formatPrice(long smallestUnits) {
        if (smallestUnits == 0) {
            return "0";
        }
        return BigDecimal.valueOf(smallestUnits)
                .movePointLeft(PRICE_DECIMALS)
                .stripTrailingZeros()
                .toPlainString();
    }

    /** Unix seconds as "MMM dd HH:mm" in UTC. */
    public static String formatTimestamp(long epochSeconds) {
        return TIMESTAMP.format(Instant.ofEpochSecond(epochSeconds));
    }

    private static String grouped(long value) {
        return String.format(Locale.US, "%,d", value);
    }

    private static String venueIcon(TransactionType type) {
        return type.getVenue() == TransactionType.Venue.DISPENSER ? "🎰" : "📊";
    }
}
