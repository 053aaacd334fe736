package com.dbmaster.scheduler;

import com.dbmaster.model.ExecutionRecord;
import com.dbmaster.model.ExecutionStatus;
import com.dbmaster.model.ScheduledQuery;
import com.dbmaster.repository.ExecutionRecordRepository;
import com.dbmaster.repository.InMemoryExecutionRecordRepository;
import com.dbmaster.repository.InMemoryScheduledQueryRepository;
import com.dbmaster.repository.ScheduledQueryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetentionSweeperTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private InMemoryScheduledQueryRepository schedules;
    private InMemoryExecutionRecordRepository executions;
    private RetentionSweeper sweeper;

    @BeforeEach
    void setUp() {
        schedules = new InMemoryScheduledQueryRepository();
        executions = new InMemoryExecutionRecordRepository();
        sweeper = new RetentionSweeper(schedules, executions, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ScheduledQuery schedule(String id, Integer retentionDays) {
        return schedules.save(ScheduledQuery.builder().id(id).name(id).active(true).maxHistoryRetention(retentionDays).build());
    }

    private void execution(String scheduleId, Instant at) {
        executions.save(ExecutionRecord.builder()
                .scheduledQueryId(scheduleId)
                .executionTime(at)
                .status(ExecutionStatus.SUCCESS)
                .build());
    }

    @Test
    void deletesOnlyRecordsStrictlyOlderThanTheCutoff() {
        schedule("sq-1", 7);
        Instant cutoff = NOW.minus(Duration.ofDays(7));
        execution("sq-1", cutoff.minusMillis(1));
        execution("sq-1", cutoff);
        execution("sq-1", cutoff.plusMillis(1));

        int deleted = sweeper.sweep();

        assertThat(deleted).isEqualTo(1);
        assertThat(executions.findBySchedule("sq-1", 0))
                .extracting(ExecutionRecord::getExecutionTime)
                .containsExactly(cutoff.plusMillis(1), cutoff);
    }

    @Test
    void missingRetentionFallsBackToThirtyDays() {
        schedule("sq-1", null);
        execution("sq-1", NOW.minus(Duration.ofDays(31)));
        execution("sq-1", NOW.minus(Duration.ofDays(29)));

        assertThat(sweeper.sweep()).isEqualTo(1);
    }

    @Test
    void retentionIsPerSchedule() {
        schedule("short", 1);
        schedule("long", 90);
        execution("short", NOW.minus(Duration.ofDays(2)));
        execution("long", NOW.minus(Duration.ofDays(2)));

        sweeper.sweep();

        assertThat(executions.findBySchedule("short", 0)).isEmpty();
        assertThat(executions.findBySchedule("long", 0)).hasSize(1);
    }

    @Test
    void deletesInBatchesUntilNothingIsLeft() {
        ScheduledQuery q = schedule("sq-1", 1);
        Instant old = NOW.minus(Duration.ofDays(10));
        int total = RetentionSweeper.BATCH_SIZE * 2 + 17;
        for (int i = 0; i < total; i++) {
            execution("sq-1", old.plusSeconds(i));
        }

        assertThat(sweeper.sweepSchedule(q, NOW)).isEqualTo(total);
        assertThat(executions.findBySchedule("sq-1", 0)).isEmpty();
    }

    @Test
    void failureOnOneScheduleDoesNotStopTheOthers() {
        ExecutionRecordRepository flaky = mock(ExecutionRecordRepository.class);
        ScheduledQueryRepository repo = mock(ScheduledQueryRepository.class);
        ScheduledQuery broken = ScheduledQuery.builder().id("broken").maxHistoryRetention(1).build();
        ScheduledQuery healthy = ScheduledQuery.builder().id("healthy").maxHistoryRetention(1).build();
        when(repo.findAll()).thenReturn(List.of(broken, healthy));
        when(flaky.findIdsExecutedBefore(eq("broken"), any(), anyInt()))
                .thenThrow(new IllegalStateException("store unavailable"));
        when(flaky.findIdsExecutedBefore(eq("healthy"), any(), anyInt()))
                .thenReturn(List.of("e1", "e2"));
        when(flaky.deleteAll(List.of("e1", "e2"))).thenReturn(2);

        int deleted = new RetentionSweeper(repo, flaky, Clock.fixed(NOW, ZoneOffset.UTC)).sweep();

        assertThat(deleted).isEqualTo(2);
    }

    @Test
    void listingFailureIsReported() {
        ScheduledQueryRepository repo = mock(ScheduledQueryRepository.class);
        when(repo.findAll()).thenThrow(new IllegalStateException("store unavailable"));

        assertThatThrownBy(() -> new RetentionSweeper(repo, executions, Clock.fixed(NOW, ZoneOffset.UTC)).sweep())
                .isInstanceOf(RetentionSweepException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
