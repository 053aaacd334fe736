package com.dbmaster.service;

/**
 * Thrown when a request carries no authenticated principal.
 */
public class AuthenticationException extends RuntimeException {
    public AuthenticationException(String message) {
        super(message);
    }
}
