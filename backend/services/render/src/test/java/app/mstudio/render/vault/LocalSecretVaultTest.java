package app.mstudio.render.vault;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalSecretVaultTest {

    private static final String MASTER_KEY = "MDEyMzQ1Njc4OTAxMjM0NTY3ODkwMTIzNDU2Nzg5MDE=";

    private final LocalSecretVault vault = new LocalSecretVault(new VaultProps(MASTER_KEY, "test-key", true));

    @Test
    void decryptsWhatItEncrypted() {
        byte[] aad = "ws-1:runway".getBytes(StandardCharsets.UTF_8);

        EncryptedSecret secret = vault.encrypt("rk_live_123".getBytes(StandardCharsets.UTF_8), aad);

        assertThat(secret.keyId()).isEqualTo("test-key");
        assertThat(new String(vault.decrypt(secret), StandardCharsets.UTF_8)).isEqualTo("rk_live_123");
    }

    @Test
    void secretCopiedToAnotherOwnerFailsAuthentication() {
        EncryptedSecret secret = vault.encrypt("rk_live_123".getBytes(StandardCharsets.UTF_8),
                "ws-1:runway".getBytes(StandardCharsets.UTF_8));
        EncryptedSecret moved = secret.boundTo("ws-2:runway".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> vault.decrypt(moved)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void tamperedCiphertextIsRejected() {
        EncryptedSecret secret = vault.encrypt("rk_live_123".getBytes(StandardCharsets.UTF_8), null);
        byte[] tampered = secret.ciphertext().clone();
        tampered[0] ^= 0x01;

        assertThatThrownBy(() -> vault.decrypt(new EncryptedSecret(tampered, secret.wrappedDataKey(),
                secret.keyId(), secret.nonce(), secret.aad())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void incompleteSecretIsRejectedBeforeDecryption() {
        EncryptedSecret secret = vault.encrypt("rk_live_123".getBytes(StandardCharsets.UTF_8), null);

        assertThatThrownBy(() -> vault.decrypt(new EncryptedSecret(secret.ciphertext(), secret.wrappedDataKey(),
                secret.keyId(), null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("incomplete");
    }

    @Test
    void refusesToStartWithoutKeyWhenRequired() {
        assertThatThrownBy(() -> new LocalSecretVault(new VaultProps(null, null, true)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("master-key");
    }

    @Test
    void fallsBackToEphemeralKey() {
        LocalSecretVault ephemeral = new LocalSecretVault(new VaultProps("", null, false));

        EncryptedSecret secret = ephemeral.encrypt("value".getBytes(StandardCharsets.UTF_8), null);

        assertThat(ephemeral.keyId()).isEqualTo("local-ephemeral");
        assertThat(ephemeral.decrypt(secret)).isEqualTo("value".getBytes(StandardCharsets.UTF_8));
    }
}
