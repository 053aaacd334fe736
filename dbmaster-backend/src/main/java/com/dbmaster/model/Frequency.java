package com.dbmaster.model;

/**
 * Recurrence models supported by scheduled queries.
 */
public enum Frequency {
    ONCE,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    CUSTOM
}
