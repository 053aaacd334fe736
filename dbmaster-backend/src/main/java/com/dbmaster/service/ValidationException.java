package com.dbmaster.service;

/**
 * Thrown for missing or malformed input. Reported synchronously, never retried.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
