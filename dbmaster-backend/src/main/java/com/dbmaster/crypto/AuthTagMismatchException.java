package com.dbmaster.crypto;

/**
 * Thrown when a current-format ciphertext fails authentication or cannot be parsed.
 */
public class AuthTagMismatchException extends EncryptionException {
    public AuthTagMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
