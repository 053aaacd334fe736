package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-schedule notification block. Alert conditions are evaluated in list order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationSettings {
    private boolean enabled;

    @Builder.Default
    private Set<NotificationChannel> channels = new LinkedHashSet<>();

    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    private WebhookConfig webhookConfig;

    @Builder.Default
    private List<AlertCondition> alertConditions = new ArrayList<>();
}
