package com.dbmaster.pool;

/**
 * Thrown when stored credentials cannot be decrypted or are rejected by the server. Never retried.
 */
public class CredentialException extends RuntimeException {
    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
