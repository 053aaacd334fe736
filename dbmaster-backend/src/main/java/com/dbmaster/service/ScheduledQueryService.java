package com.dbmaster.service;

import com.dbmaster.api.ScheduledQueryRequest;
import com.dbmaster.model.AlertCondition;
import com.dbmaster.model.ExecutionRecord;
import com.dbmaster.model.NotificationChannel;
import com.dbmaster.model.NotificationSettings;
import com.dbmaster.model.QueryParameter;
import com.dbmaster.model.Recurrence;
import com.dbmaster.model.ScheduleWindow;
import com.dbmaster.model.ScheduledQuery;
import com.dbmaster.repository.ExecutionRecordRepository;
import com.dbmaster.repository.ScheduledQueryRepository;
import com.dbmaster.scheduler.CronMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CRUD for scheduled queries. Definitions are validated when saved so the executor never meets a
 * malformed recurrence or alert condition.
 */
@Slf4j
@Service
public class ScheduledQueryService {
    private static final Set<String> WEBHOOK_METHODS = Set.of("GET", "POST", "PUT");

    private final ScheduledQueryRepository scheduledQueryRepository;
    private final ExecutionRecordRepository executionRecordRepository;
    private final ConnectionService connectionService;
    private final Clock clock;

    public ScheduledQueryService(
            ScheduledQueryRepository scheduledQueryRepository,
            ExecutionRecordRepository executionRecordRepository,
            ConnectionService connectionService,
            Clock clock
    ) {
        this.scheduledQueryRepository = scheduledQueryRepository;
        this.executionRecordRepository = executionRecordRepository;
        this.connectionService = connectionService;
        this.clock = clock;
    }

    public ScheduledQuery create(String ownerId, ScheduledQueryRequest request) {
        validate(request);
        connectionService.resolveForOwner(ownerId, request.getConnectionId());

        Instant now = clock.instant();
        ScheduledQuery saved = scheduledQueryRepository.save(apply(ScheduledQuery.builder(), request)
                .active(request.getActive() == null || request.getActive())
                .ownerId(ownerId)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Scheduled query created: schedule_id={}, owner_id={}, frequency={}",
                saved.getId(), ownerId, saved.getRecurrence().getFrequency());
        return saved;
    }

    public ScheduledQuery update(String ownerId, String scheduleId, ScheduledQueryRequest request) {
        ScheduledQuery existing = get(ownerId, scheduleId);
        validate(request);
        connectionService.resolveForOwner(ownerId, request.getConnectionId());

        ScheduledQuery updated = apply(existing.toBuilder(), request)
                .active(request.getActive() != null ? request.getActive() : existing.isActive())
                .updatedAt(clock.instant())
                .build();
        return scheduledQueryRepository.save(updated);
    }

    public ScheduledQuery get(String ownerId, String scheduleId) {
        ScheduledQuery query = scheduledQueryRepository.findById(scheduleId)
                .orElseThrow(() -> new NotFoundException("Scheduled query not found: " + scheduleId));
        if (!Objects.equals(ownerId, query.getOwnerId())) {
            throw new AccessDeniedException("Scheduled query belongs to another user");
        }
        return query;
    }

    public List<ScheduledQuery> listForOwner(String ownerId) {
        return scheduledQueryRepository.findByOwner(ownerId);
    }

    public List<ScheduledQuery> listActiveForOwner(String ownerId) {
        return scheduledQueryRepository.findByOwner(ownerId).stream()
                .filter(ScheduledQuery::isActive)
                .collect(Collectors.toList());
    }

    public ScheduledQuery setActive(String ownerId, String scheduleId, boolean active) {
        ScheduledQuery existing = get(ownerId, scheduleId);
        if (existing.isActive() == active) {
            return existing;
        }
        log.info("Scheduled query toggled: schedule_id={}, active={}", scheduleId, active);
        return scheduledQueryRepository.save(existing.toBuilder().active(active).updatedAt(clock.instant()).build());
    }

    /**
     * Deletes the schedule together with its execution history.
     */
    public void delete(String ownerId, String scheduleId) {
        get(ownerId, scheduleId);
        int removed = executionRecordRepository.deleteBySchedule(scheduleId);
        scheduledQueryRepository.delete(scheduleId);
        log.info("Scheduled query deleted: schedule_id={}, executions_removed={}", scheduleId, removed);
    }

    public List<ExecutionRecord> listExecutions(String ownerId, String scheduleId, int limit) {
        get(ownerId, scheduleId);
        return executionRecordRepository.findBySchedule(scheduleId, limit > 0 ? limit : 20);
    }

    private static ScheduledQuery.ScheduledQueryBuilder apply(ScheduledQuery.ScheduledQueryBuilder builder, ScheduledQueryRequest request) {
        return builder
                .name(request.getName().trim())
                .description(request.getDescription())
                .connectionId(request.getConnectionId())
                .sql(request.getSql())
                .parameters(request.getParameters() != null ? new ArrayList<>(request.getParameters()) : new ArrayList<>())
                .recurrence(request.getRecurrence())
                .window(request.getWindow())
                .notifications(request.getNotifications())
                .maxHistoryRetention(request.getMaxHistoryRetention());
    }

    void validate(ScheduledQueryRequest request) {
        Recurrence recurrence = request.getRecurrence();
        if (recurrence == null) {
            throw new ValidationException("Recurrence is required");
        }
        if (recurrence instanceof Recurrence.Custom custom) {
            try {
                CronMatcher.validate(custom.cronExpression());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid CRON expression: " + e.getMessage(), e);
            }
        }

        if (request.getMaxHistoryRetention() != null && request.getMaxHistoryRetention() < 1) {
            throw new ValidationException("maxHistoryRetention must be at least 1 day");
        }

        validateWindow(request.getWindow());
        validateParameters(request.getParameters());
        validateNotifications(request.getNotifications());
    }

    private static void validateWindow(ScheduleWindow window) {
        if (window == null || window.getStartTime() == null) {
            throw new ValidationException("Schedule start time is required");
        }
        try {
            window.zoneId();
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid time zone: " + window.getTimezone(), e);
        }
        if (window.getStartTime() != null && window.getEndTime() != null
                && window.getEndTime().isBefore(window.getStartTime())) {
            throw new ValidationException("Window end time is before its start time");
        }
    }

    private static void validateParameters(List<QueryParameter> parameters) {
        if (parameters == null) {
            return;
        }
        for (QueryParameter parameter : parameters) {
            if (parameter == null || parameter.getName() == null || parameter.getName().isBlank()) {
                throw new ValidationException("Every parameter needs a name");
            }
            try {
                parameter.boundValue();
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid value for parameter '" + parameter.getName() + "': " + e.getMessage(), e);
            }
        }
    }

    private static void validateNotifications(NotificationSettings settings) {
        if (settings == null) {
            return;
        }
        if (settings.getAlertConditions() != null) {
            for (AlertCondition condition : settings.getAlertConditions()) {
                if (condition == null) {
                    throw new ValidationException("Alert conditions must not contain null entries");
                }
            }
        }
        if (settings.isEnabled() && settings.getChannels() != null && settings.getChannels().contains(NotificationChannel.WEBHOOK)) {
            if (settings.getWebhookConfig() == null || settings.getWebhookConfig().getUrl() == null
                    || settings.getWebhookConfig().getUrl().isBlank()) {
                throw new ValidationException("Webhook channel requires a webhook URL");
            }
            String method = settings.getWebhookConfig().getMethod();
            if (method != null && !WEBHOOK_METHODS.contains(method.trim().toUpperCase(Locale.ROOT))) {
                throw new ValidationException("Unsupported webhook method: " + method);
            }
        }
    }
}
