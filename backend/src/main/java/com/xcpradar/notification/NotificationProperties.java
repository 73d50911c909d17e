package com.xcpradar.notification;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.List;

/**
 * Telegram delivery settings. Channel ids are one comma-delimited string so a single env var
 * (XCPRADAR_NOTIFICATION_CHANNEL_IDS) can carry several chats.
 */
@ConfigurationProperties(prefix = "xcpradar.notification")
@NoArgsConstructor
@Getter
@Setter
public class NotificationProperties {

    /** Comma-delimited chat ids; blank disables delivery. */
    private String channelIds = "";

    /** Sticker file id sent after each sale message; blank for none. */
    private String saleStickerId;

    private String botToken;

    private String apiBaseUrl = "https://api.telegram.org";

    /** Per-request timeout in seconds. */
    private int timeoutSeconds = 15;

    public List<String> channelIdList() {
        if (channelIds == null || channelIds.isBlank()) {
            return List.of();
        }
        return Arrays.stream(channelIds.split(","))
                .map(String::strip)
                .filter(id -> !id.isEmpty())
                .distinct()
                .toList();
    }

    public boolean hasSaleSticker() {
        return saleStickerId != null && !saleStickerId.isBlank();
    }
}
