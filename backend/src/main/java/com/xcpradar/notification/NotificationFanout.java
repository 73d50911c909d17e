package com.xcpradar.notification;

import com.xcpradar.domain.Transaction;
import com.xcpradar.domain.TransactionNotifier;
import com.xcpradar.ingestion.store.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers each stored transaction to every configured chat concurrently. A failing chat never affects
 * the others; once all deliveries settle the row is marked notified, whatever their outcome.
 * With no chats configured nothing is sent and nothing is marked.
 */
@Slf4j
@Service
public class NotificationFanout implements TransactionNotifier {

    private final ChatDeliveryClient deliveryClient;
    private final NotificationFormatter formatter;
    private final TransactionStore store;
    private final NotificationProperties properties;
    private final List<String> channelIds;

    public NotificationFanout(ChatDeliveryClient deliveryClient, NotificationFormatter formatter,
                              TransactionStore store, NotificationProperties properties) {
        this.deliveryClient = deliveryClient;
        this.formatter = formatter;
        this.store = store;
        this.properties = properties;
        this.channelIds = properties.channelIdList();
        if (channelIds.isEmpty()) {
            log.warn("No notification channels configured (xcpradar.notification.channel-ids); notifications will be skipped");
        } else {
            log.info("Notification fan-out to {} channel(s){}", channelIds.size(),
                    properties.hasSaleSticker() ? " with sale sticker" : "");
        }
    }

    /**
     * Blocks until every channel has either succeeded or failed.
     */
    @Override
    public void publish(Transaction transaction) {
        if (channelIds.isEmpty()) {
            log.debug("Skipping notification for {}: no channels", transaction.getTxHash());
            return;
        }
        String text = formatter.format(transaction);
        boolean withSticker = transaction.isSale() && properties.hasSaleSticker();
        AtomicInteger delivered = new AtomicInteger();

        Flux.fromIterable(channelIds)
                .flatMap(channelId -> deliver(channelId, text, withSticker)
                        .doOnSuccess(v -> delivered.incrementAndGet())
                        .onErrorResume(e -> {
                            log.warn("Notification {} to channel {} failed: {}", transaction.getTxHash(), channelId, e.getMessage());
                            return Mono.empty();
                        }))
                .then()
                .block();

        store.markNotified(transaction.getTxHash());
        if (delivered.get() > 0) {
            log.info("Notified {} ({}) to {}/{} channel(s)", transaction.getAsset(), transaction.getType(),
                    delivered.get(), channelIds.size());
        }
    }

    private Mono<Void> deliver(String channelId, String text, boolean withSticker) {
        Mono<Void> message = Mono.defer(() -> deliveryClient.sendText(channelId, text));
        if (!withSticker) {
            return message;
        }
        return message.then(Mono.defer(() -> deliveryClient.sendSticker(channelId, properties.getSaleStickerId())
                .onErrorResume(e -> {
                    log.warn("Sale sticker to channel {} failed: {}", channelId, e.getMessage());
                    return Mono.empty();
                })));
    }
}
