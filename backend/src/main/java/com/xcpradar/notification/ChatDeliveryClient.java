package com.xcpradar.notification;

import reactor.core.publisher.Mono;

/**
 * Sends to one chat. Failures surface as {@link ChatDeliveryException} on the returned Mono.
 */
public interface ChatDeliveryClient {

    /** Markdown text with link previews disabled. */
    Mono<Void> sendText(String channelId, String text);

    Mono<Void> sendSticker(String channelId, String stickerId);
}
