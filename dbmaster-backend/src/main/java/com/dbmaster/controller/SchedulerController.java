package com.dbmaster.controller;

import com.dbmaster.api.SweepResponse;
import com.dbmaster.scheduler.BatchSummary;
import com.dbmaster.scheduler.RetentionSweeper;
import com.dbmaster.scheduler.ScheduledQueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry points for an external periodic trigger. The in-process trigger calls the same components.
 */
@RestController
@RequestMapping("/v1/scheduler")
public class SchedulerController {

    private static final Logger log = LoggerFactory.getLogger(SchedulerController.class);

    private final ScheduledQueryExecutor executor;
    private final RetentionSweeper sweeper;

    public SchedulerController(ScheduledQueryExecutor executor, RetentionSweeper sweeper) {
        this.executor = executor;
        this.sweeper = sweeper;
    }

    /**
     * POST /v1/scheduler/run
     */
    @PostMapping("/run")
    public ResponseEntity<BatchSummary> run() {
        log.info("External scheduler tick");
        return ResponseEntity.ok(executor.runDueSchedules());
    }

    /**
     * POST /v1/scheduler/sweep
     */
    @PostMapping("/sweep")
    public ResponseEntity<SweepResponse> sweep() {
        log.info("External retention sweep");
        return ResponseEntity.ok(new SweepResponse(sweeper.sweep()));
    }
}
