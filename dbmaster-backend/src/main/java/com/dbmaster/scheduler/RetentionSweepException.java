package com.dbmaster.scheduler;

/**
 * Thrown when the sweep could not even list the schedules to clean up.
 */
public class RetentionSweepException extends RuntimeException {
    public RetentionSweepException(String message, Throwable cause) {
        super(message, cause);
    }
}
