package com.xcpradar.notification;

import com.xcpradar.domain.Transaction;
import com.xcpradar.domain.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationFormatterTest {

    /** 2024-01-05T14:30:00Z */
    private static final long JAN_05_1430 = 1_704_465_000L;

    private final NotificationFormatter formatter = new NotificationFormatter();

    @Test
    @DisplayName("price is scaled by 10^8 with trailing zeros stripped")
    void formatPrice() {
        assertThat(NotificationFormatter.formatPrice(150_000_000L)).isEqualTo("1.5");
        assertThat(NotificationFormatter.formatPrice(100_000_000L)).isEqualTo("1");
        assertThat(NotificationFormatter.formatPrice(0L)).isEqualTo("0");
        assertThat(NotificationFormatter.formatPrice(150_000L)).isEqualTo("0.0015");
        assertThat(NotificationFormatter.formatPrice(1L)).isEqualTo("0.00000001");
        assertThat(NotificationFormatter.formatPrice(1_234_500_000_000L)).isEqualTo("12345");
    }

    @Test
    @DisplayName("timestamp renders as MMM dd HH:mm in UTC")
    void formatTimestamp() {
        assertThat(NotificationFormatter.formatTimestamp(JAN_05_1430)).isEqualTo("Jan 05 14:30");
    }

    @Test
    @DisplayName("dispenser sale message")
    void dispenserSale() {
        Transaction tx = tx("abc123", TransactionType.DIS_SALE, 1, 150_000L, "BTC", 870_123);

        assertThat(formatter.format(tx)).isEqualTo(
                "💰 SOLD: FAKEASF x1 | Paid: 0.0015 BTC\n"
                        + "Jan 05 14:30 | Block 870,123 | 🔗 [TokenScan](https://cp20.tokenscan.io/tx/abc123) 🎰");
    }

    @Test
    @DisplayName("DEX sale message uses the DEX icons and groups large amounts")
    void dexSale() {
        Transaction tx = tx("def456", TransactionType.DEX_SALE, 1_000, 50_000_000L, "XCP", 870_200);

        assertThat(formatter.format(tx)).isEqualTo(
                "⚡ SOLD: FAKEASF x1,000 | Paid: 0.5 XCP\n"
                        + "Jan 05 14:30 | Block 870,200 | 🔗 [TokenScan](https://cp20.tokenscan.io/tx/def456) 📊");
    }

    @Test
    @DisplayName("dispenser listing message links to the Horizon dispenser tab")
    void dispenserListing() {
        Transaction tx = tx("aaa111", TransactionType.DIS_LISTING, 3, 200_000L, "BTC", 870_124);

        assertThat(formatter.format(tx)).isEqualTo(
                "📋 LISTING: FAKEASF | Qty: 3 | Price: 0.002 BTC\n"
                        + "Jan 05 14:30 | Block 870,124 | 🔗 [Horizon]"
                        + "(https://horizon.market/assets/FAKEASF?from=1M&quote_asset=BTC&tab=buy&type=dispenser) 🎰");
    }

    @Test
    @DisplayName("DEX listing message links to the Horizon swap tab")
    void dexListing() {
        Transaction tx = tx("bbb222", TransactionType.DEX_LISTING, 2, 0L, "XCP", 870_125);

        assertThat(formatter.format(tx)).isEqualTo(
                "🔄 LISTING: FAKEASF | Qty: 2 | Price: 0 XCP\n"
                        + "Jan 05 14:30 | Block 870,125 | 🔗 [Horizon]"
                        + "(https://horizon.market/assets/FAKEASF?from=1M&quote_asset=XCP&tab=buy&type=swap) 📊");
    }

    private static Transaction tx(String hash, TransactionType type, long amount, long price, String paymentAsset, long block) {
        return Transaction.builder()
                .txHash(hash)
                .type(type)
                .asset("FAKEASF")
                .amount(amount)
                .price(price)
                .paymentAsset(paymentAsset)
                .timestamp(JAN_05_1430)
                .blockIndex(block)
                .createdAt(JAN_05_1430 + 60)
                .build();
    }
}
