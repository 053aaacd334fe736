package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * History entry for one firing of a scheduled query. Created RUNNING and moved to a terminal status
 * exactly once; only the notification fields change afterwards.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {
    private String id;
    private String scheduledQueryId;
    private String connectionId;
    private String ownerId;
    private Instant executionTime;
    private Instant completionTime;
    private ExecutionStatus status;
    private String sql;

    @Builder.Default
    private List<QueryParameter> parameters = new ArrayList<>();

    private List<Map<String, Object>> results;
    private Integer resultCount;
    private String error;
    private boolean notificationSent;
    /** Null when no delivery was attempted: notifications off, no verdict, or the owner suppressed the type. */
    private NotificationStatus notificationStatus;
    private boolean alertTriggered;
    private String alertReason;
    private Long executionTimeMs;

    public void markSucceeded(List<Map<String, Object>> rows, Instant completedAt, long elapsedMs) {
        requireRunning();
        this.status = ExecutionStatus.SUCCESS;
        this.results = rows;
        this.resultCount = rows != null ? rows.size() : 0;
        this.completionTime = completedAt;
        this.executionTimeMs = elapsedMs;
    }

    public void markFailed(String message, Instant completedAt, long elapsedMs) {
        requireRunning();
        this.status = ExecutionStatus.ERROR;
        this.error = message;
        this.completionTime = completedAt;
        this.executionTimeMs = elapsedMs;
    }

    private void requireRunning() {
        if (status != null && status.isTerminal()) {
            throw new IllegalStateException("Execution " + id + " already finished with status " + status);
        }
    }
}
