package com.dbmaster.service;

import com.dbmaster.api.ScheduledQueryRequest;
import com.dbmaster.model.AlertCondition;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.model.ExecutionRecord;
import com.dbmaster.model.ExecutionStatus;
import com.dbmaster.model.NotificationChannel;
import com.dbmaster.model.NotificationSettings;
import com.dbmaster.model.ParameterType;
import com.dbmaster.model.QueryParameter;
import com.dbmaster.model.Recurrence;
import com.dbmaster.model.ScheduleWindow;
import com.dbmaster.model.ScheduledQuery;
import com.dbmaster.model.WebhookConfig;
import com.dbmaster.repository.InMemoryExecutionRecordRepository;
import com.dbmaster.repository.InMemoryScheduledQueryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScheduledQueryServiceTest {

    private static final String OWNER = "u1";
    private static final Instant NOW = Instant.parse("2024-01-15T09:00:00Z");

    private InMemoryScheduledQueryRepository schedules;
    private InMemoryExecutionRecordRepository executions;
    private ConnectionService connectionService;
    private ScheduledQueryService service;

    @BeforeEach
    void setUp() {
        schedules = new InMemoryScheduledQueryRepository();
        executions = new InMemoryExecutionRecordRepository();
        connectionService = mock(ConnectionService.class);
        when(connectionService.resolveForOwner(OWNER, "c1"))
                .thenReturn(ConnectionConfig.builder().id("c1").ownerId(OWNER).build());
        when(connectionService.resolveForOwner("intruder", "c1"))
                .thenThrow(new AccessDeniedException("Connection belongs to another user"));
        service = new ScheduledQueryService(schedules, executions, connectionService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ScheduledQueryRequest request() {
        ScheduledQueryRequest request = new ScheduledQueryRequest();
        request.setName("  Replication lag  ");
        request.setConnectionId("c1");
        request.setSql("SELECT 1");
        request.setRecurrence(new Recurrence.Hourly(5));
        request.setWindow(ScheduleWindow.builder().startTime(NOW).build());
        return request;
    }

    @Test
    void createDefaultsToActiveAndTrimsName() {
        ScheduledQuery created = service.create(OWNER, request());

        assertThat(created.getId()).isNotBlank();
        assertThat(created.isActive()).isTrue();
        assertThat(created.getName()).isEqualTo("Replication lag");
        assertThat(created.getOwnerId()).isEqualTo(OWNER);
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
        assertThat(created.retentionDays()).isEqualTo(ScheduledQuery.DEFAULT_HISTORY_RETENTION_DAYS);
    }

    @Test
    void createRequiresOwnedConnection() {
        assertThatThrownBy(() -> service.create("intruder", request())).isInstanceOf(AccessDeniedException.class);
        assertThat(schedules.findAll()).isEmpty();
    }

    @Test
    void rejectsInvalidCron() {
        ScheduledQueryRequest request = request();
        request.setRecurrence(new Recurrence.Custom("0 25 * * *"));

        assertThatThrownBy(() -> service.create(OWNER, request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("hour");
    }

    @Test
    void rejectsNonPositiveRetention() {
        ScheduledQueryRequest request = request();
        request.setMaxHistoryRetention(0);

        assertThatThrownBy(() -> service.create(OWNER, request)).isInstanceOf(ValidationException.class);
    }

    @Test
    void requiresStartTime() {
        ScheduledQueryRequest noWindow = request();
        noWindow.setWindow(null);
        ScheduledQueryRequest noStart = request();
        noStart.setWindow(ScheduleWindow.builder().endTime(NOW.plusSeconds(3600)).timezone("UTC").build());

        assertThatThrownBy(() -> service.create(OWNER, noWindow))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Schedule start time is required");
        assertThatThrownBy(() -> service.create(OWNER, noStart))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Schedule start time is required");
        assertThat(schedules.findAll()).isEmpty();
    }

    @Test
    void rejectsUnknownTimeZoneAndInvertedWindow() {
        ScheduledQueryRequest badZone = request();
        badZone.setWindow(ScheduleWindow.builder().startTime(NOW).timezone("Nowhere/City").build());
        ScheduledQueryRequest inverted = request();
        inverted.setWindow(ScheduleWindow.builder()
                .startTime(NOW)
                .endTime(NOW.minusSeconds(60))
                .build());

        assertThatThrownBy(() -> service.create(OWNER, badZone)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.create(OWNER, inverted)).isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsUncoercibleParameters() {
        ScheduledQueryRequest request = request();
        request.setParameters(new ArrayList<>(List.of(new QueryParameter("since", ParameterType.DATE, "yesterday"))));

        assertThatThrownBy(() -> service.create(OWNER, request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("since");
    }

    @Test
    void rejectsNullAlertCondition() {
        ScheduledQueryRequest request = request();
        request.setNotifications(NotificationSettings.builder()
                .enabled(true)
                .alertConditions(new ArrayList<>(Arrays.asList((AlertCondition) null)))
                .build());

        assertThatThrownBy(() -> service.create(OWNER, request)).isInstanceOf(ValidationException.class);
    }

    @Test
    void webhookChannelNeedsUrlAndSupportedMethod() {
        ScheduledQueryRequest noUrl = request();
        noUrl.setNotifications(NotificationSettings.builder()
                .enabled(true)
                .channels(new LinkedHashSet<>(List.of(NotificationChannel.WEBHOOK)))
                .build());
        ScheduledQueryRequest badMethod = request();
        badMethod.setNotifications(NotificationSettings.builder()
                .enabled(true)
                .channels(new LinkedHashSet<>(List.of(NotificationChannel.WEBHOOK)))
                .webhookConfig(WebhookConfig.builder().url("https://hooks.example.com").method("DELETE").build())
                .build());

        assertThatThrownBy(() -> service.create(OWNER, noUrl)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.create(OWNER, badMethod))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("DELETE");
    }

    @Test
    void updateKeepsActiveFlagWhenNotGiven() {
        ScheduledQuery created = service.create(OWNER, request());
        service.setActive(OWNER, created.getId(), false);

        ScheduledQueryRequest change = request();
        change.setSql("SELECT 2");
        ScheduledQuery updated = service.update(OWNER, created.getId(), change);

        assertThat(updated.isActive()).isFalse();
        assertThat(updated.getSql()).isEqualTo("SELECT 2");
        assertThat(updated.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void ownershipIsEnforced() {
        ScheduledQuery created = service.create(OWNER, request());

        assertThatThrownBy(() -> service.get("intruder", created.getId())).isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> service.get(OWNER, "missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.delete("intruder", created.getId())).isInstanceOf(AccessDeniedException.class);
    }

    @Test
    void activeListingSkipsPausedSchedules() {
        ScheduledQuery running = service.create(OWNER, request());
        ScheduledQuery paused = service.create(OWNER, request());
        service.setActive(OWNER, paused.getId(), false);

        assertThat(service.listForOwner(OWNER)).hasSize(2);
        assertThat(service.listActiveForOwner(OWNER)).extracting(ScheduledQuery::getId).containsExactly(running.getId());
    }

    @Test
    void deleteCascadesToExecutionHistory() {
        ScheduledQuery created = service.create(OWNER, request());
        executions.save(ExecutionRecord.builder().scheduledQueryId(created.getId()).executionTime(NOW).status(ExecutionStatus.SUCCESS).build());
        executions.save(ExecutionRecord.builder().scheduledQueryId("other").executionTime(NOW).status(ExecutionStatus.SUCCESS).build());

        service.delete(OWNER, created.getId());

        assertThat(schedules.findById(created.getId())).isEmpty();
        assertThat(executions.findBySchedule(created.getId(), 0)).isEmpty();
        assertThat(executions.findBySchedule("other", 0)).hasSize(1);
    }

    @Test
    void executionsAreListedNewestFirst() {
        ScheduledQuery created = service.create(OWNER, request());
        for (int i = 0; i < 3; i++) {
            executions.save(ExecutionRecord.builder()
                    .scheduledQueryId(created.getId())
                    .executionTime(NOW.plusSeconds(i))
                    .status(ExecutionStatus.SUCCESS)
                    .build());
        }

        assertThat(service.listExecutions(OWNER, created.getId(), 2))
                .extracting(ExecutionRecord::getExecutionTime)
                .containsExactly(NOW.plusSeconds(2), NOW.plusSeconds(1));
    }
}
