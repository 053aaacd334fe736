package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-owner delivery preferences. Each notification type can be switched off independently.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreferences {
    private String ownerId;

    @Builder.Default
    private Email email = new Email(true, null);

    @Builder.Default
    private Push push = new Push(true, new ArrayList<>());

    @Builder.Default
    private boolean scheduleNotifications = true;

    @Builder.Default
    private boolean alertNotifications = true;

    @Builder.Default
    private boolean errorNotifications = true;

    public static NotificationPreferences defaults(String ownerId) {
        return NotificationPreferences.builder().ownerId(ownerId).build();
    }

    public boolean allows(NotificationType type) {
        if (type == null) {
            return true;
        }
        switch (type) {
            case QUERY_EXECUTION_SUCCESS:
                return scheduleNotifications;
            case QUERY_EXECUTION_ALERT:
                return alertNotifications;
            case QUERY_EXECUTION_ERROR:
                return errorNotifications;
            default:
                return true;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Email {
        private boolean enabled;
        private String address;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Push {
        private boolean enabled;
        private List<String> deviceTokens = new ArrayList<>();
    }
}
