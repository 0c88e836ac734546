package app.mstudio.render.domain.entity;

import app.mstudio.render.domain.type.CredentialStatus;
import app.mstudio.render.vault.EncryptedSecret;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * A workspace's own API key for one video provider, stored sealed. At most one row per workspace and provider.
 */
@Entity
@Table(name = "provider_credentials", schema = "app_render")
public class ProviderCredentialEntity {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private UUID workspaceId;

    @Column(name = "provider", nullable = false, updatable = false)
    private String provider;

    @Column(name = "encrypted_secret", nullable = false)
    private byte[] ciphertext;

    @Column(name = "wrapped_data_key")
    private byte[] wrappedDataKey;

    @Column(name = "key_id")
    private String keyId;

    @Column(name = "nonce")
    private byte[] nonce;

    @Column(name = "aad")
    private byte[] aad;

    @Column(name = "key_hint")
    private String keyHint;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "status", columnDefinition = "provider_credential_status", nullable = false)
    private CredentialStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected ProviderCredentialEntity() {
    }

    public static ProviderCredentialEntity create(UUID workspaceId, String provider, Instant now) {
        ProviderCredentialEntity entity = new ProviderCredentialEntity();
        entity.id = UUID.randomUUID();
        entity.workspaceId = workspaceId;
        entity.provider = provider;
        entity.createdAt = now;
        entity.updatedAt = now;
        entity.status = CredentialStatus.disconnected;
        return entity;
    }

    /**
     * Replaces the stored key and reconnects the credential.
     */
    public void connect(EncryptedSecret secret, String hint, Instant now) {
        this.ciphertext = secret.ciphertext();
        this.wrappedDataKey = secret.wrappedDataKey();
        this.keyId = secret.keyId();
        this.nonce = secret.nonce();
        this.aad = secret.aad();
        this.keyHint = hint;
        this.status = CredentialStatus.connected;
        this.updatedAt = now;
    }

    public void disconnect(Instant now) {
        this.status = CredentialStatus.disconnected;
        this.updatedAt = now;
    }

    public boolean isConnected() {
        return status == CredentialStatus.connected;
    }

    /**
     * Sealed material as stored, to be opened against {@code expectedAad}. A mismatch with the aad the secret
     * was sealed with makes decryption fail.
     */
    public EncryptedSecret sealedSecret(byte[] expectedAad) {
        return new EncryptedSecret(ciphertext, wrappedDataKey, keyId, nonce, expectedAad);
    }

    public UUID getId() {
        return id;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public String getProvider() {
        return provider;
    }

    public String getKeyId() {
        return keyId;
    }

    public String getKeyHint() {
        return keyHint;
    }

    public CredentialStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
