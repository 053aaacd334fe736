package com.dbmaster.service;

/**
 * Thrown when the calling principal does not own the resource it addresses.
 */
public class AccessDeniedException extends RuntimeException {
    public AccessDeniedException(String message) {
        super(message);
    }
}
