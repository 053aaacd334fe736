package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-app notification record kept for the owner, listing the channels that delivered it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    private String id;
    private String ownerId;
    private NotificationType type;
    private String title;
    private String message;
    private NotificationPriority priority;
    private boolean read;

    @Builder.Default
    private Set<NotificationChannel> sentVia = new LinkedHashSet<>();

    private String scheduledQueryId;
    private String executionId;
    private Map<String, Object> data;
    private Instant createdAt;
    private Instant updatedAt;
}
