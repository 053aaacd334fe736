package com.dbmaster.controller;

import com.dbmaster.api.ScheduledQueryRequest;
import com.dbmaster.api.ToggleActiveRequest;
import com.dbmaster.model.ExecutionRecord;
import com.dbmaster.model.ScheduledQuery;
import com.dbmaster.scheduler.ScheduledQueryExecutor;
import com.dbmaster.service.ScheduledQueryService;
import com.dbmaster.web.CurrentUser;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/scheduled-queries")
public class ScheduledQueryController {

    private final ScheduledQueryService scheduledQueryService;
    private final ScheduledQueryExecutor executor;

    public ScheduledQueryController(ScheduledQueryService scheduledQueryService, ScheduledQueryExecutor executor) {
        this.scheduledQueryService = scheduledQueryService;
        this.executor = executor;
    }

    @GetMapping
    public ResponseEntity<List<ScheduledQuery>> list(@CurrentUser String userId) {
        return ResponseEntity.ok(scheduledQueryService.listForOwner(userId));
    }

    @GetMapping("/active")
    public ResponseEntity<List<ScheduledQuery>> listActive(@CurrentUser String userId) {
        return ResponseEntity.ok(scheduledQueryService.listActiveForOwner(userId));
    }

    /**
     * POST /v1/scheduled-queries
     */
    @PostMapping
    public ResponseEntity<ScheduledQuery> create(@CurrentUser String userId, @Valid @RequestBody ScheduledQueryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduledQueryService.create(userId, request));
    }

    @GetMapping("/{scheduleId}")
    public ResponseEntity<ScheduledQuery> get(@CurrentUser String userId, @PathVariable("scheduleId") String scheduleId) {
        return ResponseEntity.ok(scheduledQueryService.get(userId, scheduleId));
    }

    @PutMapping("/{scheduleId}")
    public ResponseEntity<ScheduledQuery> update(
            @CurrentUser String userId,
            @PathVariable("scheduleId") String scheduleId,
            @Valid @RequestBody ScheduledQueryRequest request) {
        return ResponseEntity.ok(scheduledQueryService.update(userId, scheduleId, request));
    }

    @PatchMapping("/{scheduleId}/active")
    public ResponseEntity<ScheduledQuery> toggleActive(
            @CurrentUser String userId,
            @PathVariable("scheduleId") String scheduleId,
            @Valid @RequestBody ToggleActiveRequest request) {
        return ResponseEntity.ok(scheduledQueryService.setActive(userId, scheduleId, request.getActive()));
    }

    /**
     * Deletes the schedule and its execution history.
     */
    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<Void> delete(@CurrentUser String userId, @PathVariable("scheduleId") String scheduleId) {
        scheduledQueryService.delete(userId, scheduleId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Run now, bypassing the due check. A failed run is recorded before the error is returned.
     *
     * POST /v1/scheduled-queries/{scheduleId}/run
     */
    @PostMapping("/{scheduleId}/run")
    public ResponseEntity<ExecutionRecord> run(@CurrentUser String userId, @PathVariable("scheduleId") String scheduleId) {
        return ResponseEntity.ok(executor.runNow(userId, scheduleId));
    }

    @GetMapping("/{scheduleId}/executions")
    public ResponseEntity<List<ExecutionRecord>> executions(
            @CurrentUser String userId,
            @PathVariable("scheduleId") String scheduleId,
            @RequestParam(value = "limit", required = false, defaultValue = "20") int limit) {
        return ResponseEntity.ok(scheduledQueryService.listExecutions(userId, scheduleId, limit));
    }
}
