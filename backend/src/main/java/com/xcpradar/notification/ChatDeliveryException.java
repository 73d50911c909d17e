package com.xcpradar.notification;

/**
 * Delivery to one chat failed (HTTP error, transport error, or missing credentials).
 */
public class ChatDeliveryException extends RuntimeException {

    public ChatDeliveryException(String message) {
        super(message);
    }

    public ChatDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
