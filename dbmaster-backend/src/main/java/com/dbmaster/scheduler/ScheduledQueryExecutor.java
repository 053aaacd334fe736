package com.dbmaster.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.dbmaster.model.AlertCondition;
import com.dbmaster.model.AlertConditionType;
import com.dbmaster.model.AlertVerdict;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.model.ExecutionRecord;
import com.dbmaster.model.ExecutionStatus;
import com.dbmaster.model.NotificationPriority;
import com.dbmaster.model.NotificationRequest;
import com.dbmaster.model.NotificationResult;
import com.dbmaster.model.NotificationSettings;
import com.dbmaster.model.NotificationStatus;
import com.dbmaster.model.NotificationType;
import com.dbmaster.model.QueryOutcome;
import com.dbmaster.model.QueryParameter;
import com.dbmaster.model.ScheduledQuery;
import com.dbmaster.notification.NotificationService;
import com.dbmaster.pool.ManagedPool;
import com.dbmaster.pool.PoolRegistry;
import com.dbmaster.pool.QueryExecutionException;
import com.dbmaster.pool.QueryResult;
import com.dbmaster.repository.ConnectionRepository;
import com.dbmaster.repository.ExecutionRecordRepository;
import com.dbmaster.repository.ScheduledQueryRepository;
import com.dbmaster.service.AccessDeniedException;
import com.dbmaster.service.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs due scheduled queries and records their history.
 *
 * <p>Each firing creates a RUNNING record, runs the statement on the pooled connection with the
 * schedule's bound parameters, moves the record to SUCCESS or ERROR exactly once and then, when
 * the schedule has notifications enabled, asks the alert evaluator whether to notify. One
 * schedule's failure never aborts the others in the same tick.
 */
@Component
public class ScheduledQueryExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScheduledQueryExecutor.class);

    static final int SAMPLE_ROWS_IN_MESSAGE = 3;
    static final int MAX_ROWS_IN_PAYLOAD = 10;
    static final int DEFAULT_WORKER_THREADS = 4;
    static final String FAILURE_REASON = "Query execution failed";

    private final ScheduledQueryRepository scheduledQueryRepository;
    private final ExecutionRecordRepository executionRecordRepository;
    private final ConnectionRepository connectionRepository;
    private final PoolRegistry poolRegistry;
    private final ScheduleEvaluator scheduleEvaluator;
    private final AlertEvaluator alertEvaluator;
    private final NotificationService notificationService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService workers;

    @Autowired
    public ScheduledQueryExecutor(
            ScheduledQueryRepository scheduledQueryRepository,
            ExecutionRecordRepository executionRecordRepository,
            ConnectionRepository connectionRepository,
            PoolRegistry poolRegistry,
            ScheduleEvaluator scheduleEvaluator,
            AlertEvaluator alertEvaluator,
            NotificationService notificationService,
            ObjectMapper objectMapper,
            Clock clock,
            Environment environment
    ) {
        this(scheduledQueryRepository, executionRecordRepository, connectionRepository, poolRegistry,
                scheduleEvaluator, alertEvaluator, notificationService, objectMapper, clock,
                newWorkerPool(environment.getProperty("dbmaster.scheduler.worker-threads", Integer.class, DEFAULT_WORKER_THREADS)));
    }

    public ScheduledQueryExecutor(
            ScheduledQueryRepository scheduledQueryRepository,
            ExecutionRecordRepository executionRecordRepository,
            ConnectionRepository connectionRepository,
            PoolRegistry poolRegistry,
            ScheduleEvaluator scheduleEvaluator,
            AlertEvaluator alertEvaluator,
            NotificationService notificationService,
            ObjectMapper objectMapper,
            Clock clock,
            ExecutorService workers
    ) {
        this.scheduledQueryRepository = scheduledQueryRepository;
        this.executionRecordRepository = executionRecordRepository;
        this.connectionRepository = connectionRepository;
        this.poolRegistry = poolRegistry;
        this.scheduleEvaluator = scheduleEvaluator;
        this.alertEvaluator = alertEvaluator;
        this.notificationService = notificationService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.workers = workers;
    }

    /**
     * Evaluates every active schedule against the current time and runs the due ones on the worker
     * pool. Waits for all firings of this tick before returning.
     */
    public BatchSummary runDueSchedules() {
        String previousTraceId = MDC.get("trace_id");
        String traceId = UUID.randomUUID().toString();
        MDC.put("trace_id", traceId);
        try {
            Instant now = clock.instant();
            List<ScheduledQuery> active = scheduledQueryRepository.findActive();

            List<Future<ExecutionRecord>> futures = new ArrayList<>();
            int due = 0;
            for (ScheduledQuery schedule : active) {
                boolean isDue;
                try {
                    isDue = scheduleEvaluator.isDue(schedule, now);
                } catch (RuntimeException e) {
                    log.error("Failed to evaluate schedule: schedule_id={}", schedule.getId(), e);
                    continue;
                }
                if (!isDue) {
                    continue;
                }
                due++;
                futures.add(workers.submit(() -> {
                    MDC.put("trace_id", traceId);
                    try {
                        return fire(schedule).record();
                    } finally {
                        MDC.remove("trace_id");
                    }
                }));
            }

            int succeeded = 0;
            int failed = 0;
            for (Future<ExecutionRecord> future : futures) {
                try {
                    ExecutionRecord record = future.get();
                    if (record.getStatus() == ExecutionStatus.SUCCESS) {
                        succeeded++;
                    } else {
                        failed++;
                    }
                } catch (ExecutionException e) {
                    failed++;
                    log.error("Scheduled execution crashed", e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for scheduled executions");
                    break;
                }
            }

            BatchSummary summary = new BatchSummary(active.size(), due, succeeded, failed);
            log.info("Scheduler tick finished: checked={}, due={}, succeeded={}, failed={}",
                    summary.checked(), summary.due(), summary.succeeded(), summary.failed());
            return summary;
        } finally {
            if (previousTraceId != null) {
                MDC.put("trace_id", previousTraceId);
            } else {
                MDC.remove("trace_id");
            }
        }
    }

    /**
     * Runs the owner's schedule immediately, bypassing the due check.
     *
     * @return the finished execution record
     * @throws QueryExecutionException when the run failed; the failure is recorded first
     */
    public ExecutionRecord runNow(String ownerId, String scheduleId) {
        ScheduledQuery schedule = scheduledQueryRepository.findById(scheduleId)
                .orElseThrow(() -> new NotFoundException("Scheduled query not found: " + scheduleId));
        if (!Objects.equals(ownerId, schedule.getOwnerId())) {
            throw new AccessDeniedException("Scheduled query belongs to another user");
        }

        log.info("Manual execution requested: schedule_id={}, owner_id={}", scheduleId, ownerId);
        Firing firing = fire(schedule);
        if (firing.failure() != null) {
            if (firing.failure() instanceof QueryExecutionException qe) {
                throw qe;
            }
            throw new QueryExecutionException(firing.record().getError(), firing.failure());
        }
        return firing.record();
    }

    private Firing fire(ScheduledQuery schedule) {
        Instant startedAt = clock.instant();
        ExecutionRecord record = executionRecordRepository.save(ExecutionRecord.builder()
                .scheduledQueryId(schedule.getId())
                .connectionId(schedule.getConnectionId())
                .ownerId(schedule.getOwnerId())
                .executionTime(startedAt)
                .status(ExecutionStatus.RUNNING)
                .sql(schedule.getSql())
                .parameters(schedule.getParameters() != null ? new ArrayList<>(schedule.getParameters()) : new ArrayList<>())
                .notificationSent(false)
                .build());
        log.info("Executing scheduled query: schedule_id={}, execution_id={}, name={}", schedule.getId(), record.getId(), schedule.getName());

        long start = System.nanoTime();
        QueryOutcome outcome;
        RuntimeException failure = null;
        try {
            ConnectionConfig connection = resolveConnection(schedule);
            ManagedPool pool = poolRegistry.getPool(connection);
            QueryResult result = poolRegistry.executeQuery(pool, schedule.getSql(),
                    bindParameters(schedule.getParameters()), pool.getOptions().getQueryTimeoutMs());
            connectionRepository.touch(connection.getId(), clock.instant());

            record.markSucceeded(result.rows(), clock.instant(), elapsedMs(start));
            outcome = new QueryOutcome.Rows(result.rows());
            log.info("Scheduled query succeeded: schedule_id={}, execution_id={}, rows={}, elapsed_ms={}",
                    schedule.getId(), record.getId(), record.getResultCount(), record.getExecutionTimeMs());
        } catch (RuntimeException e) {
            failure = e;
            String message = e.getMessage() != null ? e.getMessage() : "Unknown error";
            record.markFailed(message, clock.instant(), elapsedMs(start));
            outcome = new QueryOutcome.Failure(message);
            log.error("Scheduled query failed: schedule_id={}, execution_id={}, error={}", schedule.getId(), record.getId(), message);
        }

        record = executionRecordRepository.save(record);
        scheduledQueryRepository.updateLastExecution(schedule.getId(), startedAt, record.getStatus());

        if (schedule.notificationsEnabled()) {
            record = notify(schedule, record, outcome);
        }
        return new Firing(record, failure);
    }

    private ConnectionConfig resolveConnection(ScheduledQuery schedule) {
        ConnectionConfig connection = connectionRepository.findById(schedule.getConnectionId())
                .orElseThrow(() -> new NotFoundException("Connection not found: " + schedule.getConnectionId()));
        if (!Objects.equals(connection.getOwnerId(), schedule.getOwnerId())) {
            throw new AccessDeniedException("Connection belongs to another user");
        }
        return connection;
    }

    static List<Object> bindParameters(List<QueryParameter> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return List.of();
        }
        List<Object> values = new ArrayList<>(parameters.size());
        for (QueryParameter parameter : parameters) {
            try {
                values.add(parameter.boundValue());
            } catch (IllegalArgumentException e) {
                throw new QueryExecutionException("Invalid value for parameter '" + parameter.getName() + "': " + e.getMessage(), e);
            }
        }
        return values;
    }

    private ExecutionRecord notify(ScheduledQuery schedule, ExecutionRecord record, QueryOutcome outcome) {
        Optional<AlertVerdict> verdict;
        if (outcome instanceof QueryOutcome.Failure failure) {
            verdict = Optional.of(new AlertVerdict(AlertConditionType.ERROR, new AlertCondition.Error(),
                    FAILURE_REASON + ": " + failure.message()));
        } else {
            verdict = alertEvaluator.evaluate(schedule.getNotifications().getAlertConditions(), outcome);
        }
        if (verdict.isEmpty()) {
            log.debug("No alert condition matched: schedule_id={}, execution_id={}", schedule.getId(), record.getId());
            return record;
        }

        NotificationRequest request = buildRequest(schedule, record, outcome, verdict.get());
        NotificationStatus status;
        boolean sent;
        try {
            NotificationResult result = notificationService.send(request, schedule.getOwnerId());
            sent = !result.suppressed();
            // A suppressed type was never attempted; the status stays unset.
            status = result.suppressed() ? null : (result.anyDelivered() ? NotificationStatus.SENT : NotificationStatus.FAILED);
        } catch (RuntimeException e) {
            log.error("Failed to send notification: schedule_id={}, execution_id={}", schedule.getId(), record.getId(), e);
            sent = false;
            status = NotificationStatus.FAILED;
        }

        ExecutionRecord updated = record.toBuilder()
                .notificationSent(sent)
                .notificationStatus(status)
                .alertTriggered(true)
                .alertReason(verdict.get().reason())
                .build();
        return executionRecordRepository.save(updated);
    }

    NotificationRequest buildRequest(ScheduledQuery schedule, ExecutionRecord record, QueryOutcome outcome, AlertVerdict verdict) {
        NotificationSettings settings = schedule.getNotifications();
        boolean isError = verdict.type() == AlertConditionType.ERROR;

        String reason = isError ? FAILURE_REASON : verdict.reason();
        StringBuilder message = new StringBuilder()
                .append("Alert triggered for query \"").append(schedule.getName()).append("\": ").append(reason);
        List<Map<String, Object>> rows = List.of();
        if (outcome instanceof QueryOutcome.Rows r) {
            rows = r.rows();
            message.append(". Returned ").append(rows.size()).append(" rows");
            if (!rows.isEmpty()) {
                message.append(". Sample results: ").append(toJson(rows.subList(0, Math.min(SAMPLE_ROWS_IN_MESSAGE, rows.size()))));
            }
        } else if (outcome instanceof QueryOutcome.Failure f) {
            message.append(". Error: ").append(f.message());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scheduledQueryId", schedule.getId());
        data.put("executionId", record.getId());
        data.put("condition", verdict.type().name());
        data.put("reason", verdict.reason());
        data.put("results", new ArrayList<>(rows.subList(0, Math.min(MAX_ROWS_IN_PAYLOAD, rows.size()))));
        if (outcome instanceof QueryOutcome.Failure f) {
            data.put("error", f.message());
        }

        return NotificationRequest.builder()
                .type(isError ? NotificationType.QUERY_EXECUTION_ERROR : NotificationType.QUERY_EXECUTION_ALERT)
                .title("Alert: " + schedule.getName())
                .message(message.toString())
                .priority(NotificationPriority.HIGH)
                .channels(settings.getChannels() != null ? new LinkedHashSet<>(settings.getChannels()) : new LinkedHashSet<>())
                .recipients(settings.getRecipients() != null ? new ArrayList<>(settings.getRecipients()) : new ArrayList<>())
                .webhookConfig(settings.getWebhookConfig())
                .data(data)
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "dbmaster-scheduler-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private record Firing(ExecutionRecord record, RuntimeException failure) {
    }
}
