package com.dbmaster.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-channel delivery outcome of one notification.
 *
 * @param notificationId id of the stored in-app notification, null when suppressed
 * @param suppressed true when the owner's preferences turned this notification type off
 * @param outcomes channel to outcome
 */
public record NotificationResult(String notificationId, boolean suppressed, Map<NotificationChannel, ChannelOutcome> outcomes) {

    public NotificationResult {
        outcomes = outcomes == null || outcomes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(outcomes));
    }

    public static NotificationResult suppressedResult() {
        return new NotificationResult(null, true, Collections.emptyMap());
    }

    public boolean anyDelivered() {
        return outcomes.values().stream().anyMatch(ChannelOutcome::success);
    }

    public record ChannelOutcome(boolean success, String error) {
        public static ChannelOutcome delivered() {
            return new ChannelOutcome(true, null);
        }

        public static ChannelOutcome failed(String error) {
            return new ChannelOutcome(false, error);
        }
    }
}
