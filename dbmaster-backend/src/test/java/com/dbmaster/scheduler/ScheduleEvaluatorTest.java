package com.dbmaster.scheduler;

import com.dbmaster.model.Recurrence;
import com.dbmaster.model.ScheduleWindow;
import com.dbmaster.model.ScheduledQuery;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleEvaluatorTest {

    private final ScheduleEvaluator evaluator = new ScheduleEvaluator();

    private static ScheduledQuery schedule(Recurrence recurrence) {
        return ScheduledQuery.builder()
                .id("sq-1")
                .active(true)
                .recurrence(recurrence)
                .build();
    }

    @Test
    void inactiveScheduleNeverFires() {
        ScheduledQuery q = schedule(new Recurrence.Once());
        q.setActive(false);

        assertThat(evaluator.isDue(q, Instant.parse("2024-01-15T09:30:00Z"))).isFalse();
    }

    @Test
    void onceFiresOnlyUntilFirstExecution() {
        ScheduledQuery q = schedule(new Recurrence.Once());
        Instant now = Instant.parse("2024-01-15T09:30:00Z");

        assertThat(evaluator.isDue(q, now)).isTrue();
        q.setLastExecutionAt(now);
        assertThat(evaluator.isDue(q, now.plus(Duration.ofDays(3)))).isFalse();
    }

    @Test
    void hourlyFiresAtConfiguredMinuteOnce() {
        ScheduledQuery q = schedule(new Recurrence.Hourly(15));
        Instant at = Instant.parse("2024-01-15T10:15:00Z");

        assertThat(evaluator.isDue(q, at)).isTrue();
        assertThat(evaluator.isDue(q, at.plusSeconds(60))).isFalse();

        q.setLastExecutionAt(at.plusSeconds(2));
        assertThat(evaluator.isDue(q, at.plusSeconds(30))).isFalse();
        assertThat(evaluator.isDue(q, at.plus(Duration.ofHours(1)))).isTrue();
    }

    @Test
    void dailyIsIdempotentWithinTheSameMinute() {
        ScheduledQuery q = schedule(new Recurrence.Daily(9, 30));
        Instant first = Instant.parse("2024-01-15T09:30:05Z");

        assertThat(evaluator.isDue(q, first)).isTrue();
        q.setLastExecutionAt(first);
        assertThat(evaluator.isDue(q, Instant.parse("2024-01-15T09:30:40Z"))).isFalse();
    }

    @Test
    void dailyFiresNextDayEvenIfPreviousRunStartedLateInTheMinute() {
        ScheduledQuery q = schedule(new Recurrence.Daily(9, 30));
        q.setLastExecutionAt(Instant.parse("2024-01-15T09:30:59Z"));

        assertThat(evaluator.isDue(q, Instant.parse("2024-01-16T09:30:00Z"))).isTrue();
    }

    @Test
    void weeklyFiresOnListedDaysAtTheConfiguredTime() {
        // Monday and Wednesday at 09:00
        ScheduledQuery q = schedule(new Recurrence.Weekly(Set.of(1, 3), 9, 0));

        assertThat(evaluator.isDue(q, Instant.parse("2024-01-15T09:00:00Z"))).isTrue();
        assertThat(evaluator.isDue(q, Instant.parse("2024-01-16T09:00:00Z"))).isFalse();
        assertThat(evaluator.isDue(q, Instant.parse("2024-01-15T09:01:00Z"))).isFalse();
    }

    @Test
    void weeklyGuardSkipsSecondListedDayWithinSevenDays() {
        ScheduledQuery q = schedule(new Recurrence.Weekly(Set.of(1, 3), 9, 0));
        q.setLastExecutionAt(Instant.parse("2024-01-15T09:00:00Z"));

        assertThat(evaluator.isDue(q, Instant.parse("2024-01-17T09:00:00Z"))).isFalse();
        assertThat(evaluator.isDue(q, Instant.parse("2024-01-22T09:00:00Z"))).isTrue();
    }

    @Test
    void monthlyFiresOncePerCalendarMonth() {
        ScheduledQuery q = schedule(new Recurrence.Monthly(1, 0, 0));
        Instant feb1 = Instant.parse("2024-02-01T00:00:00Z");

        assertThat(evaluator.isDue(q, feb1)).isTrue();
        q.setLastExecutionAt(feb1);
        assertThat(evaluator.isDue(q, feb1.plusSeconds(30))).isFalse();
        assertThat(evaluator.isDue(q, Instant.parse("2024-03-01T00:00:00Z"))).isTrue();
    }

    @Test
    void customCronRespectsMinimumSpacing() {
        ScheduledQuery q = schedule(new Recurrence.Custom("* * * * *"));
        Instant now = Instant.parse("2024-01-15T09:30:00Z");

        assertThat(evaluator.isDue(q, now)).isTrue();
        q.setLastExecutionAt(now);
        assertThat(evaluator.isDue(q, now.plus(Duration.ofMinutes(3)))).isFalse();
        assertThat(evaluator.isDue(q, now.plus(Duration.ofMinutes(4)))).isTrue();
    }

    @Test
    void invalidCronNeverFires() {
        ScheduledQuery q = schedule(new Recurrence.Custom("61 * * * *"));

        assertThat(evaluator.isDue(q, Instant.parse("2024-01-15T09:30:00Z"))).isFalse();
    }

    @Test
    void wallClockFieldsAreReadInScheduleZone() {
        ScheduledQuery q = schedule(new Recurrence.Daily(9, 0));
        q.setWindow(ScheduleWindow.builder().timezone("America/New_York").build());

        // 09:00 in New York during EST is 14:00 UTC
        assertThat(evaluator.isDue(q, Instant.parse("2024-01-15T14:00:00Z"))).isTrue();
        assertThat(evaluator.isDue(q, Instant.parse("2024-01-15T09:00:00Z"))).isFalse();
    }

    @Test
    void invalidZoneSkipsSchedule() {
        ScheduledQuery q = schedule(new Recurrence.Hourly(0));
        q.setWindow(ScheduleWindow.builder().timezone("Mars/Olympus").build());

        assertThat(evaluator.isDue(q, Instant.parse("2024-01-15T09:00:00Z"))).isFalse();
    }

    @Test
    void windowBoundsAreInclusive() {
        Instant start = Instant.parse("2024-01-15T09:00:00Z");
        Instant end = Instant.parse("2024-01-15T11:00:00Z");
        ScheduledQuery q = schedule(new Recurrence.Hourly(0));
        q.setWindow(ScheduleWindow.builder().startTime(start).endTime(end).build());

        assertThat(evaluator.isDue(q, start)).isTrue();
        assertThat(evaluator.isDue(q, end)).isTrue();
        assertThat(evaluator.isDue(q, start.minus(Duration.ofHours(1)))).isFalse();
        assertThat(evaluator.isDue(q, end.plus(Duration.ofHours(1)))).isFalse();
    }

    @Test
    void missingRecurrenceNeverFires() {
        assertThat(evaluator.isDue(schedule(null), Instant.parse("2024-01-15T09:00:00Z"))).isFalse();
    }
}
