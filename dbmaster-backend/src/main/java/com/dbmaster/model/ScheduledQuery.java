package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A stored schedule definition: what to run, against which connection, when, and who to tell.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledQuery {
    public static final int DEFAULT_HISTORY_RETENTION_DAYS = 30;

    private String id;
    private String name;
    private String description;
    private String connectionId;
    private String sql;

    @Builder.Default
    private List<QueryParameter> parameters = new ArrayList<>();

    private Recurrence recurrence;
    private ScheduleWindow window;
    private NotificationSettings notifications;
    private Integer maxHistoryRetention;
    private boolean active;
    private Instant lastExecutionAt;
    private ExecutionStatus lastExecutionStatus;
    private String ownerId;
    private Instant createdAt;
    private Instant updatedAt;

    public int retentionDays() {
        return maxHistoryRetention != null && maxHistoryRetention > 0
                ? maxHistoryRetention
                : DEFAULT_HISTORY_RETENTION_DAYS;
    }

    public boolean notificationsEnabled() {
        return notifications != null && notifications.isEnabled();
    }
}
