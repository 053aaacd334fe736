package com.dbmaster.crypto;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.generators.SCrypt;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Encrypts connection passwords at rest.
 *
 * <p>Current format is {@code hex(iv):hex(tag):base64(ciphertext)} produced by AES-256-GCM with a
 * fresh 16-byte IV per call. The legacy format {@code hex(iv):base64(ciphertext)} (AES-256-CBC,
 * key derived with the fixed salt {@code "salt"}) is still accepted by {@link #decrypt(String)} so
 * stored values can be migrated with {@link #reEncrypt(String)}.
 *
 * <p>Both keys are derived with scrypt (N=16384, r=8, p=1, 32 bytes) once at construction; instances are
 * immutable and safe for concurrent use.
 */
@Slf4j
@Component
public class CredentialVault {

    public static final String DEFAULT_SECRET = "default-key-change-in-production";
    public static final String DEFAULT_SALT = "default-salt-change-in-production";
    static final String LEGACY_SALT = "salt";

    private static final String GCM_ALGORITHM = "AES/GCM/NoPadding";
    private static final String LEGACY_ALGORITHM = "AES/CBC/PKCS5Padding";
    private static final int SCRYPT_COST = 16_384;
    private static final int SCRYPT_BLOCK_SIZE = 8;
    private static final int SCRYPT_PARALLELISM = 1;
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH = 16;

    private static final HexFormat HEX = HexFormat.of();

    private final SecretKey key;
    private final SecretKey legacyKey;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public CredentialVault(Environment environment) {
        this(resolve(environment, "dbmaster.encryption.key", "ENCRYPTION_KEY", DEFAULT_SECRET),
                resolve(environment, "dbmaster.encryption.salt", "KEY_SALT", DEFAULT_SALT));
    }

    public CredentialVault(String secret, String salt) {
        if (secret == null || secret.isEmpty()) {
            throw new EncryptionException("Encryption secret must not be empty");
        }
        if (salt == null || salt.isEmpty()) {
            throw new EncryptionException("Encryption salt must not be empty");
        }
        if (DEFAULT_SECRET.equals(secret) || DEFAULT_SALT.equals(salt)) {
            log.warn("Using default encryption key or salt. Set ENCRYPTION_KEY and KEY_SALT before storing real credentials.");
        }
        this.key = deriveKey(secret, salt);
        this.legacyKey = deriveKey(secret, LEGACY_SALT);
    }

    /**
     * Encrypts a non-empty value in the current format.
     *
     * @param plaintext value to protect
     * @return {@code iv:tag:ciphertext}
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new EncryptionException("Cannot encrypt empty text");
        }
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(GCM_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext.
            int ctLength = sealed.length - TAG_LENGTH;
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, ctLength);
            byte[] tag = Arrays.copyOfRange(sealed, ctLength, sealed.length);
            return HEX.formatHex(iv) + ":" + HEX.formatHex(tag) + ":" + Base64.getEncoder().encodeToString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to encrypt data: " + e.getMessage(), e);
        }
    }

    /**
     * Decrypts a value in the current or the legacy format.
     *
     * @param encrypted stored value
     * @return plaintext
     * @throws AuthTagMismatchException if a current-format value is corrupt or was tampered with
     * @throws LegacyDecryptionException if a legacy value cannot be decrypted
     * @throws EncryptionException on empty input or an unknown format
     */
    public String decrypt(String encrypted) {
        if (encrypted == null || encrypted.isEmpty()) {
            throw new EncryptionException("Cannot decrypt empty text");
        }
        String[] parts = encrypted.split(":", -1);
        if (parts.length == 3) {
            return decryptCurrent(parts);
        }
        if (parts.length == 2) {
            return decryptLegacy(parts);
        }
        throw new EncryptionException("Invalid encrypted text format");
    }

    /**
     * Decrypts with format auto-detection and encrypts again in the current format.
     */
    public String reEncrypt(String encrypted) {
        return encrypt(decrypt(encrypted));
    }

    public boolean isLegacyFormat(String encrypted) {
        return encrypted != null && !encrypted.isEmpty() && encrypted.split(":", -1).length == 2;
    }

    /**
     * Round-trips a synthetic value to catch a broken configuration early.
     *
     * @return true when the round trip succeeded
     */
    public boolean verify() {
        String probe = "encryption-test-" + System.currentTimeMillis();
        try {
            boolean ok = probe.equals(decrypt(encrypt(probe)));
            if (!ok) {
                log.error("Encryption self-test failed: round trip returned a different value");
            }
            return ok;
        } catch (EncryptionException e) {
            log.error("Encryption self-test failed: {}", e.getMessage());
            return false;
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void verifyOnStartup() {
        if (verify()) {
            log.info("Encryption self-test passed");
        } else {
            log.warn("Encryption self-test failed; stored credentials cannot be used until the key configuration is fixed");
        }
    }

    private String decryptCurrent(String[] parts) {
        try {
            byte[] iv = HEX.parseHex(parts[0]);
            byte[] tag = HEX.parseHex(parts[1]);
            byte[] ciphertext = Base64.getDecoder().decode(parts[2]);
            if (iv.length != IV_LENGTH || tag.length != TAG_LENGTH) {
                throw new AuthTagMismatchException("Invalid IV or authentication tag length", null);
            }

            byte[] sealed = new byte[ciphertext.length + tag.length];
            System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
            System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);

            Cipher cipher = Cipher.getInstance(GCM_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new AuthTagMismatchException("Failed to decrypt data: authentication tag mismatch", e);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new AuthTagMismatchException("Failed to decrypt data: " + e.getMessage(), e);
        }
    }

    private String decryptLegacy(String[] parts) {
        try {
            byte[] iv = HEX.parseHex(parts[0]);
            byte[] ciphertext = Base64.getDecoder().decode(parts[1]);

            Cipher cipher = Cipher.getInstance(LEGACY_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, legacyKey, new IvParameterSpec(iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new LegacyDecryptionException("Failed to decrypt data with legacy method: " + e.getMessage(), e);
        }
    }

    static SecretKey deriveKey(String secret, String salt) {
        byte[] password = secret.getBytes(StandardCharsets.UTF_8);
        try {
            byte[] key = SCrypt.generate(password, salt.getBytes(StandardCharsets.UTF_8),
                    SCRYPT_COST, SCRYPT_BLOCK_SIZE, SCRYPT_PARALLELISM, KEY_LENGTH);
            return new SecretKeySpec(key, "AES");
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Failed to derive encryption key", e);
        } finally {
            Arrays.fill(password, (byte) 0);
        }
    }

    private static String resolve(Environment environment, String propKey, String envKey, String fallback) {
        String v = environment.getProperty(propKey);
        if (v == null || v.isBlank()) {
            v = environment.getProperty(envKey);
        }
        return v == null || v.isBlank() ? fallback : v.trim();
    }
}
