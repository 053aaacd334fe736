package com.dbmaster.crypto;

/**
 * Thrown when a two-field legacy ciphertext cannot be decrypted.
 */
public class LegacyDecryptionException extends EncryptionException {
    public LegacyDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
