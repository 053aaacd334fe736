package com.dbmaster.notification;

import java.util.List;

/**
 * Where a channel should deliver, resolved from the request and the owner's preferences.
 */
public record DeliveryTarget(String ownerId, List<String> emailRecipients, List<String> deviceTokens) {
    public DeliveryTarget {
        emailRecipients = emailRecipients != null ? List.copyOf(emailRecipients) : List.of();
        deviceTokens = deviceTokens != null ? List.copyOf(deviceTokens) : List.of();
    }
}
