package com.xcpradar.ingestion.classifier;

import com.xcpradar.ingestion.adapter.DispenseEvent;
import com.xcpradar.ingestion.adapter.DispenserEvent;
import com.xcpradar.ingestion.adapter.LedgerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds the price of a dispenser sale by looking up the originating dispenser among all of the
 * asset's dispensers. Closed dispensers count too: the sale itself may have emptied it.
 * A failed or empty lookup degrades to price 0 rather than dropping the sale.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ListingPriceResolver {

    static final String DISPENSER_PAYMENT_ASSET = "BTC";

    private final LedgerClient ledgerClient;

    public ResolvedPrice resolve(DispenseEvent sale) {
        if (sale.dispenserTxHash() == null || sale.dispenserTxHash().isBlank()) {
            log.warn("Sale {} has no dispenser reference; recording price 0", sale.txHash());
            return ResolvedPrice.unknown();
        }
        try {
            for (DispenserEvent listing : ledgerClient.listListingsForAsset(sale.asset())) {
                if (sale.dispenserTxHash().equals(listing.txHash())) {
                    return new ResolvedPrice(listing.satoshiRate(), DISPENSER_PAYMENT_ASSET);
                }
            }
            log.warn("Dispenser {} for sale {} not found among {} listings; recording price 0",
                    sale.dispenserTxHash(), sale.txHash(), sale.asset());
        } catch (RuntimeException e) {
            log.warn("Price lookup failed for sale {} ({}): {}", sale.txHash(), sale.asset(), e.getMessage());
        }
        return ResolvedPrice.unknown();
    }

    public record ResolvedPrice(long price, String paymentAsset) {

        static ResolvedPrice unknown() {
            return new ResolvedPrice(0L, DISPENSER_PAYMENT_ASSET);
        }
    }
}
