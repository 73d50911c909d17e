package com.xcpradar.ingestion.classifier;

import com.xcpradar.domain.Transaction;
import com.xcpradar.domain.TransactionType;
import com.xcpradar.ingestion.adapter.DispenseEvent;
import com.xcpradar.ingestion.adapter.DispenserEvent;
import com.xcpradar.ingestion.adapter.LedgerEvent;
import com.xcpradar.ingestion.adapter.OrderEvent;
import com.xcpradar.ingestion.adapter.OrderMatchEvent;
import com.xcpradar.ingestion.config.MonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps admitted ledger events to {@link Transaction}s.
 * <ul>
 *   <li>dispense → DIS_SALE, price from the originating dispenser</li>
 *   <li>dispenser → DIS_LISTING, price = satoshi rate in BTC</li>
 *   <li>order match → DEX_SALE when exactly one side is a quote asset</li>
 *   <li>open order → DEX_LISTING when it gives a collectible for a quote asset</li>
 * </ul>
 * Events that cannot form a valid row (zero quantity, no block, both or neither side quoted) yield empty.
 */
@Slf4j
@Component
public class MarketEventClassifier {

    private final ListingPriceResolver priceResolver;
    private final Set<String> quoteAssets;
    private final Clock clock;

    public MarketEventClassifier(ListingPriceResolver priceResolver, MonitorProperties properties, Clock clock) {
        this.priceResolver = priceResolver;
        this.quoteAssets = properties.getQuoteAssets().stream()
                .map(a -> a.strip().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.clock = clock;
    }

    public Optional<Transaction> classify(LedgerEvent event) {
        if (event.blockIndex() <= 0) {
            log.debug("Skipping {}: no block index", event.txHash());
            return Optional.empty();
        }
        if (event instanceof DispenseEvent sale) {
            return classifySale(sale);
        }
        if (event instanceof DispenserEvent listing) {
            return classifyListing(listing);
        }
        if (event instanceof OrderMatchEvent match) {
            return classifyOrderMatch(match);
        }
        if (event instanceof OrderEvent order) {
            return classifyOrder(order);
        }
        throw new IllegalArgumentException("Unsupported ledger event " + event.getClass().getName());
    }

    private Optional<Transaction> classifySale(DispenseEvent sale) {
        if (sale.quantity() <= 0) {
            log.debug("Skipping sale {}: quantity {}", sale.txHash(), sale.quantity());
            return Optional.empty();
        }
        ListingPriceResolver.ResolvedPrice price = priceResolver.resolve(sale);
        return Optional.of(base(sale, TransactionType.DIS_SALE, sale.asset(), sale.quantity())
                .price(price.price())
                .paymentAsset(price.paymentAsset())
                .build());
    }

    private Optional<Transaction> classifyListing(DispenserEvent listing) {
        if (listing.giveQuantity() <= 0) {
            log.debug("Skipping listing {}: give quantity {}", listing.txHash(), listing.giveQuantity());
            return Optional.empty();
        }
        return Optional.of(base(listing, TransactionType.DIS_LISTING, listing.asset(), listing.giveQuantity())
                .price(Math.max(0L, listing.satoshiRate()))
                .paymentAsset(ListingPriceResolver.DISPENSER_PAYMENT_ASSET)
                .build());
    }

    private Optional<Transaction> classifyOrderMatch(OrderMatchEvent match) {
        boolean forwardQuote = isQuote(match.forwardAsset());
        boolean backwardQuote = isQuote(match.backwardAsset());
        if (forwardQuote == backwardQuote) {
            log.debug("Skipping order match {}: {}/{} is not a collectible-for-quote trade",
                    match.txHash(), match.forwardAsset(), match.backwardAsset());
            return Optional.empty();
        }
        String asset = forwardQuote ? match.backwardAsset() : match.forwardAsset();
        long amount = forwardQuote ? match.backwardQuantity() : match.forwardQuantity();
        String paymentAsset = forwardQuote ? match.forwardAsset() : match.backwardAsset();
        long paid = forwardQuote ? match.forwardQuantity() : match.backwardQuantity();
        if (amount <= 0) {
            return Optional.empty();
        }
        return Optional.of(base(match, TransactionType.DEX_SALE, asset, amount)
                .price(Math.max(0L, paid / amount))
                .paymentAsset(paymentAsset)
                .build());
    }

    private Optional<Transaction> classifyOrder(OrderEvent order) {
        if (isQuote(order.giveAsset()) || !isQuote(order.getAsset())) {
            log.debug("Skipping order {}: gives {} for {}", order.txHash(), order.giveAsset(), order.getAsset());
            return Optional.empty();
        }
        if (order.giveQuantity() <= 0) {
            return Optional.empty();
        }
        return Optional.of(base(order, TransactionType.DEX_LISTING, order.giveAsset(), order.giveQuantity())
                .price(Math.max(0L, order.getQuantity() / order.giveQuantity()))
                .paymentAsset(order.getAsset())
                .build());
    }

    private Transaction.TransactionBuilder base(LedgerEvent event, TransactionType type, String asset, long amount) {
        return Transaction.builder()
                .txHash(event.txHash())
                .type(type)
                .asset(asset)
                .amount(amount)
                .timestamp(event.timestamp())
                .blockIndex(event.blockIndex())
                .notified(false)
                .createdAt(clock.instant().getEpochSecond());
    }

    private boolean isQuote(String asset) {
        return asset != null && quoteAssets.contains(asset.toUpperCase(Locale.ROOT));
    }
}
