package com.dbmaster.scheduler;

/**
 * Outcome counts of one executor tick.
 */
public record BatchSummary(int checked, int due, int succeeded, int failed) {
}
