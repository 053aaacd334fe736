package com.dbmaster.scheduler;

import com.dbmaster.model.Recurrence;
import com.dbmaster.model.ScheduleWindow;
import com.dbmaster.model.ScheduledQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Decides whether a schedule should fire at a given instant.
 *
 * <p>Every recurring frequency requires a minimum time since the last firing, so repeated or
 * overlapping trigger invocations within the same minute fire at most once. Elapsed time is
 * measured between minute-truncated instants, the resolution at which schedules are defined.
 * Wall-clock fields are read in the schedule's time zone (UTC when unset).
 */
@Slf4j
@Component
public class ScheduleEvaluator {

    static final Duration HOURLY_GUARD = Duration.ofHours(1);
    static final Duration DAILY_GUARD = Duration.ofDays(1);
    static final Duration WEEKLY_GUARD = Duration.ofDays(7);
    static final Duration CUSTOM_GUARD = Duration.ofMinutes(4);

    public boolean isDue(ScheduledQuery schedule, Instant now) {
        if (schedule == null || !schedule.isActive()) {
            return false;
        }
        Recurrence recurrence = schedule.getRecurrence();
        if (recurrence == null) {
            log.warn("Schedule has no recurrence: schedule_id={}", schedule.getId());
            return false;
        }

        ScheduleWindow window = schedule.getWindow();
        if (window != null) {
            if (window.getStartTime() != null && now.isBefore(window.getStartTime())) {
                return false;
            }
            if (window.getEndTime() != null && now.isAfter(window.getEndTime())) {
                return false;
            }
        }

        ZoneId zone;
        try {
            zone = window != null ? window.zoneId() : ZoneOffset.UTC;
        } catch (DateTimeException e) {
            log.warn("Invalid schedule time zone, skipping: schedule_id={}, timezone={}", schedule.getId(), window.getTimezone());
            return false;
        }

        Instant last = schedule.getLastExecutionAt();
        ZonedDateTime current = now.atZone(zone);

        if (recurrence instanceof Recurrence.Once) {
            return last == null;
        }
        if (recurrence instanceof Recurrence.Hourly hourly) {
            return elapsedAtLeast(last, now, HOURLY_GUARD)
                    && current.getMinute() == hourly.minute();
        }
        if (recurrence instanceof Recurrence.Daily daily) {
            return elapsedAtLeast(last, now, DAILY_GUARD)
                    && atTime(current, daily.hour(), daily.minute());
        }
        if (recurrence instanceof Recurrence.Weekly weekly) {
            int dayOfWeek = current.getDayOfWeek().getValue() % 7;
            return elapsedAtLeast(last, now, WEEKLY_GUARD)
                    && weekly.daysOfWeek().contains(dayOfWeek)
                    && atTime(current, weekly.hour(), weekly.minute());
        }
        if (recurrence instanceof Recurrence.Monthly monthly) {
            return isLaterMonth(last, current, zone)
                    && current.getDayOfMonth() == monthly.dayOfMonth()
                    && atTime(current, monthly.hour(), monthly.minute());
        }
        if (recurrence instanceof Recurrence.Custom custom) {
            if (!elapsedAtLeast(last, now, CUSTOM_GUARD)) {
                return false;
            }
            try {
                return CronMatcher.matches(custom.cronExpression(), current.toLocalDateTime());
            } catch (IllegalArgumentException e) {
                log.warn("Invalid CRON expression, schedule will not fire: schedule_id={}, cron={}, error={}",
                        schedule.getId(), custom.cronExpression(), e.getMessage());
                return false;
            }
        }

        log.warn("Unsupported recurrence: schedule_id={}, type={}", schedule.getId(), recurrence.getClass().getSimpleName());
        return false;
    }

    private static boolean elapsedAtLeast(Instant last, Instant now, Duration guard) {
        if (last == null) {
            return true;
        }
        Instant from = last.truncatedTo(ChronoUnit.MINUTES);
        Instant to = now.truncatedTo(ChronoUnit.MINUTES);
        return Duration.between(from, to).compareTo(guard) >= 0;
    }

    private static boolean atTime(ZonedDateTime current, int hour, int minute) {
        return current.getHour() == hour && current.getMinute() == minute;
    }

    private static boolean isLaterMonth(Instant last, ZonedDateTime current, ZoneId zone) {
        if (last == null) {
            return true;
        }
        YearMonth lastMonth = YearMonth.from(last.atZone(zone));
        return YearMonth.from(current).isAfter(lastMonth);
    }
}
