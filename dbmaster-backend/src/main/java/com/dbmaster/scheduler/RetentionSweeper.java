package com.dbmaster.scheduler;

import com.dbmaster.model.ScheduledQuery;
import com.dbmaster.repository.ExecutionRecordRepository;
import com.dbmaster.repository.ScheduledQueryRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Deletes execution records older than each schedule's retention window, in bounded batches.
 */
@Slf4j
@Component
public class RetentionSweeper {
    static final int BATCH_SIZE = 500;

    private final ScheduledQueryRepository scheduledQueryRepository;
    private final ExecutionRecordRepository executionRecordRepository;
    private final Clock clock;

    public RetentionSweeper(ScheduledQueryRepository scheduledQueryRepository, ExecutionRecordRepository executionRecordRepository, Clock clock) {
        this.scheduledQueryRepository = scheduledQueryRepository;
        this.executionRecordRepository = executionRecordRepository;
        this.clock = clock;
    }

    /**
     * @return number of records deleted across all schedules
     * @throws RetentionSweepException if the schedules could not be listed
     */
    public int sweep() {
        String previousTraceId = MDC.get("trace_id");
        MDC.put("trace_id", UUID.randomUUID().toString());
        try {
            List<ScheduledQuery> schedules;
            try {
                schedules = scheduledQueryRepository.findAll();
            } catch (RuntimeException e) {
                throw new RetentionSweepException("Failed to list scheduled queries for retention sweep", e);
            }

            Instant now = clock.instant();
            int total = 0;
            for (ScheduledQuery schedule : schedules) {
                try {
                    total += sweepSchedule(schedule, now);
                } catch (RuntimeException e) {
                    log.error("Retention sweep failed for schedule: schedule_id={}", schedule.getId(), e);
                }
            }
            log.info("Retention sweep finished: schedules={}, deleted={}", schedules.size(), total);
            return total;
        } finally {
            if (previousTraceId != null) {
                MDC.put("trace_id", previousTraceId);
            } else {
                MDC.remove("trace_id");
            }
        }
    }

    int sweepSchedule(ScheduledQuery schedule, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(schedule.retentionDays()));
        int deleted = 0;
        while (true) {
            List<String> ids = executionRecordRepository.findIdsExecutedBefore(schedule.getId(), cutoff, BATCH_SIZE);
            if (ids.isEmpty()) {
                break;
            }
            int removed = executionRecordRepository.deleteAll(ids);
            deleted += removed;
            if (removed == 0 || ids.size() < BATCH_SIZE) {
                break;
            }
        }
        if (deleted > 0) {
            log.info("Deleted expired executions: schedule_id={}, deleted={}, cutoff={}", schedule.getId(), deleted, cutoff);
        }
        return deleted;
    }
}
