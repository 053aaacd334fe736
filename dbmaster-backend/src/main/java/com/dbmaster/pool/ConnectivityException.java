package com.dbmaster.pool;

/**
 * Thrown when the database cannot be reached: refused, timed out, unknown host, pool exhausted.
 */
public class ConnectivityException extends RuntimeException {
    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
