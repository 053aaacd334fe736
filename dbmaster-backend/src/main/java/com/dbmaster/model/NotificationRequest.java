package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What the executor asks the notification service to deliver.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRequest {
    private NotificationType type;
    private String title;
    private String message;

    @Builder.Default
    private NotificationPriority priority = NotificationPriority.MEDIUM;

    @Builder.Default
    private Set<NotificationChannel> channels = new LinkedHashSet<>();

    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    private WebhookConfig webhookConfig;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
}
