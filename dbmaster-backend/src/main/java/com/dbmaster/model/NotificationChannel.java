package com.dbmaster.model;

/**
 * Delivery channels a scheduled query can notify through.
 */
public enum NotificationChannel {
    EMAIL,
    PUSH,
    WEBHOOK
}
