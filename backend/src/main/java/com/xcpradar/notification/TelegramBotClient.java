package com.xcpradar.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Telegram Bot API over WebClient: POST /bot{token}/sendMessage and /bot{token}/sendSticker.
 */
@Slf4j
@Component
public class TelegramBotClient implements ChatDeliveryClient {

    private final WebClient webClient;
    private final NotificationProperties properties;

    public TelegramBotClient(WebClient.Builder webClientBuilder, NotificationProperties properties) {
        this.webClient = webClientBuilder.baseUrl(properties.getApiBaseUrl()).build();
        this.properties = properties;
    }

    @Override
    public Mono<Void> sendText(String channelId, String text) {
        Map<String, Object> body = Map.of(
                "chat_id", channelId,
                "text", text,
                "parse_mode", "Markdown",
                "disable_web_page_preview", true
        );
        return post("sendMessage", channelId, body);
    }

    @Override
    public Mono<Void> sendSticker(String channelId, String stickerId) {
        return post("sendSticker", channelId, Map.of("chat_id", channelId, "sticker", stickerId));
    }

    private Mono<Void> post(String method, String channelId, Map<String, Object> body) {
        String token = properties.getBotToken();
        if (token == null || token.isBlank()) {
            return Mono.error(new ChatDeliveryException("Bot token not configured; cannot " + method));
        }
        return webClient.post()
                .uri("/bot{token}/{method}", token, method)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(Math.max(1, properties.getTimeoutSeconds())))
                .doOnSuccess(r -> log.debug("Telegram {} delivered to {}", method, channelId))
                .then()
                .onErrorMap(WebClientResponseException.class, e -> new ChatDeliveryException(
                        "Telegram " + method + " to " + channelId + " failed: HTTP " + e.getStatusCode().value()
                                + " " + e.getResponseBodyAsString(), e))
                // request exception messages embed the URI, and with it the bot token
                .onErrorMap(e -> !(e instanceof ChatDeliveryException), e -> new ChatDeliveryException(
                        "Telegram " + method + " to " + channelId + " failed: " + e.getClass().getSimpleName(), e));
    }
}
