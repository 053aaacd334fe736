package com.dbmaster.notification;

/**
 * Thrown by a channel sender when delivery failed.
 */
public class NotificationDeliveryException extends Exception {
    public NotificationDeliveryException(String message) {
        super(message);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
