package com.dbmaster.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process periodic trigger for the executor and the retention sweeper. Disabled unless
 * {@code dbmaster.scheduler.enabled} is set; deployments with an external cron call the
 * {@code /v1/scheduler} endpoints instead.
 */
@Slf4j
@Component
public class SchedulerTrigger implements AutoCloseable {

    private final ScheduledQueryExecutor executor;
    private final RetentionSweeper sweeper;
    private final boolean enabled;
    private final long tickIntervalSec;
    private final long sweepIntervalHours;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;
    private ScheduledFuture<?> sweepTask;

    public SchedulerTrigger(
            ScheduledQueryExecutor executor,
            RetentionSweeper sweeper,
            @Value("${dbmaster.scheduler.enabled:false}") boolean enabled,
            @Value("${dbmaster.scheduler.tick-interval-sec:60}") long tickIntervalSec,
            @Value("${dbmaster.scheduler.sweep-interval-hours:24}") long sweepIntervalHours
    ) {
        this.executor = executor;
        this.sweeper = sweeper;
        this.enabled = enabled;
        this.tickIntervalSec = tickIntervalSec > 0 ? tickIntervalSec : 60;
        this.sweepIntervalHours = sweepIntervalHours > 0 ? sweepIntervalHours : 24;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("In-process scheduler disabled");
            return;
        }
        start();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dbmaster-scheduler-trigger");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(this::tick, tickIntervalSec, tickIntervalSec, TimeUnit.SECONDS);
        sweepTask = scheduler.scheduleAtFixedRate(this::sweep, sweepIntervalHours, sweepIntervalHours, TimeUnit.HOURS);
        log.info("Started in-process scheduler: tick_interval_sec={}, sweep_interval_hours={}", tickIntervalSec, sweepIntervalHours);
    }

    public boolean isRunning() {
        return started.get();
    }

    void tick() {
        // Skip instead of queueing when the previous tick is still running.
        if (!ticking.compareAndSet(false, true)) {
            log.warn("Previous scheduler tick still running, skipping");
            return;
        }
        try {
            executor.runDueSchedules();
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        } finally {
            ticking.set(false);
        }
    }

    void sweep() {
        try {
            sweeper.sweep();
        } catch (RuntimeException e) {
            log.error("Retention sweep failed", e);
        }
    }

    @Override
    public void close() {
        if (!started.getAndSet(false)) {
            return;
        }
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        scheduler.shutdownNow();
        log.info("Stopped in-process scheduler");
    }
}
