package com.dbmaster.crypto;

/**
 * Thrown when a value cannot be encrypted or decrypted: empty input or an unrecognised format.
 */
public class EncryptionException extends RuntimeException {
    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
