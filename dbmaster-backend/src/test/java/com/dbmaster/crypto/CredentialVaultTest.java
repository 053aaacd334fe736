package com.dbmaster.crypto;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialVaultTest {

    private static final String SECRET = "unit-test-secret";
    private static final String SALT = "unit-test-salt";

    private static CredentialVault vault;

    @BeforeAll
    static void setUp() {
        vault = new CredentialVault(SECRET, SALT);
    }

    @Test
    void roundTripsInCurrentFormat() {
        String encrypted = vault.encrypt("s3cr3t-p@ss");

        String[] parts = encrypted.split(":");
        assertThat(parts).hasSize(3);
        assertThat(parts[0]).hasSize(32);
        assertThat(parts[1]).hasSize(32);
        assertThat(vault.decrypt(encrypted)).isEqualTo("s3cr3t-p@ss");
        assertThat(vault.isLegacyFormat(encrypted)).isFalse();
    }

    @Test
    void usesFreshIvPerCall() {
        assertThat(vault.encrypt("same")).isNotEqualTo(vault.encrypt("same"));
    }

    @Test
    void roundTripsNonAsciiText() {
        assertThat(vault.decrypt(vault.encrypt("pässwörd-密码"))).isEqualTo("pässwörd-密码");
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> vault.encrypt("")).isInstanceOf(EncryptionException.class);
        assertThatThrownBy(() -> vault.decrypt(null)).isInstanceOf(EncryptionException.class);
    }

    @Test
    void rejectsUnknownFormat() {
        assertThatThrownBy(() -> vault.decrypt("a:b:c:d"))
                .isInstanceOf(EncryptionException.class)
                .hasMessageContaining("format");
    }

    @Test
    void detectsTamperedTag() {
        String[] parts = vault.encrypt("value").split(":");
        char first = parts[1].charAt(0);
        parts[1] = (first == '0' ? '1' : '0') + parts[1].substring(1);

        assertThatThrownBy(() -> vault.decrypt(String.join(":", parts)))
                .isInstanceOf(AuthTagMismatchException.class);
    }

    @Test
    void detectsWrongKey() {
        CredentialVault other = new CredentialVault("other-secret", SALT);

        assertThatThrownBy(() -> other.decrypt(vault.encrypt("value")))
                .isInstanceOf(AuthTagMismatchException.class);
    }

    @Test
    void decryptsLegacyValueWrittenByNodeCrypto() {
        // aes-256-cbc, scryptSync(secret, "salt", 32), iv = 16 x 0x07
        String legacy = "07070707070707070707070707070707:IGn8BovfA6Xc+INTGkPHeA==";

        assertThat(vault.isLegacyFormat(legacy)).isTrue();
        assertThat(vault.decrypt(legacy)).isEqualTo("legacy-pw");
    }

    @Test
    void decryptsCurrentValueWrittenByNodeCrypto() {
        // aes-256-gcm, scryptSync(secret, salt, 32), iv = 16 x 0x09
        String current = "09090909090909090909090909090909:a5554e269874aca7bb8c1a957580e3d5:5JAzvmEAFmDA";

        assertThat(vault.decrypt(current)).isEqualTo("modern-pw");
    }

    @Test
    void reEncryptMigratesLegacyValues() {
        String migrated = vault.reEncrypt("07070707070707070707070707070707:IGn8BovfA6Xc+INTGkPHeA==");

        assertThat(vault.isLegacyFormat(migrated)).isFalse();
        assertThat(vault.decrypt(migrated)).isEqualTo("legacy-pw");
    }

    @Test
    void corruptedThreeFieldValueNeverFallsBackToLegacy() {
        assertThatThrownBy(() -> vault.decrypt("corrupted:data:here"))
                .isInstanceOf(AuthTagMismatchException.class)
                .isNotInstanceOf(LegacyDecryptionException.class);
    }

    @Test
    void corruptLegacyValueFails() {
        assertThatThrownBy(() -> vault.decrypt("00112233445566778899aabbccddeeff:bm90LWNpcGhlcnRleHQ="))
                .isInstanceOf(LegacyDecryptionException.class);
    }

    @Test
    void selfTestPasses() {
        assertThat(vault.verify()).isTrue();
    }

    @Test
    void rejectsEmptyKeyMaterial() {
        assertThatThrownBy(() -> new CredentialVault("", SALT)).isInstanceOf(EncryptionException.class);
        assertThatThrownBy(() -> new CredentialVault(SECRET, null)).isInstanceOf(EncryptionException.class);
    }
}
