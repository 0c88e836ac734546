package app.mstudio.render.credential;

import app.mstudio.render.domain.entity.ProviderCredentialEntity;
import app.mstudio.render.domain.type.CredentialStatus;
import app.mstudio.render.repository.ProviderCredentialRepository;
import app.mstudio.render.support.RenderEvents;
import app.mstudio.render.vault.EncryptedSecret;
import app.mstudio.render.vault.LocalSecretVault;
import app.mstudio.render.vault.VaultProps;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialResolverTest {

    @Mock
    ProviderCredentialRepository credentialRepository;

    LocalSecretVault vault;
    CredentialResolver resolver;
    UUID workspaceId;

    @BeforeEach
    void setup() {
        vault = new LocalSecretVault(new VaultProps("MDEyMzQ1Njc4OTAxMjM0NTY3ODkwMTIzNDU2Nzg5MDE=", "k1", true));
        workspaceId = UUID.randomUUID();
        resolver = new CredentialResolver(List.of(
                new WorkspaceCredentialSource(credentialRepository, vault),
                new PlatformCredentialSource(new PlatformKeyProps(Map.of("runway", "platform-runway", "sora", "platform-openai")))
        ), new RenderEvents(new SimpleMeterRegistry()));
    }

    @Test
    void workspaceKeyWinsOverPlatformKey() {
        when(credentialRepository.findByWorkspaceIdAndProvider(workspaceId, "runway"))
                .thenReturn(Optional.of(stored("runway", "user-runway", CredentialStatus.connected)));

        ResolvedCredential resolved = resolver.resolve("runway", workspaceId).orElseThrow();

        assertThat(resolved.apiKey()).isEqualTo("user-runway");
        assertThat(resolved.source()).isEqualTo(KeySource.user);
    }

    @Test
    void disconnectedWorkspaceKeyFallsBackToPlatform() {
        when(credentialRepository.findByWorkspaceIdAndProvider(workspaceId, "runway"))
                .thenReturn(Optional.of(stored("runway", "user-runway", CredentialStatus.disconnected)));

        ResolvedCredential resolved = resolver.resolve("runway", workspaceId).orElseThrow();

        assertThat(resolved.apiKey()).isEqualTo("platform-runway");
        assertThat(resolved.source()).isEqualTo(KeySource.platform);
    }

    @Test
    void aliasIsNormalizedBeforeLookup() {
        when(credentialRepository.findByWorkspaceIdAndProvider(workspaceId, "sora")).thenReturn(Optional.empty());

        ResolvedCredential resolved = resolver.resolve("openai", workspaceId).orElseThrow();

        assertThat(resolved.apiKey()).isEqualTo("platform-openai");
    }

    @Test
    void undecryptableKeyIsTreatedAsMissing() {
        EncryptedSecret secret = vault.encrypt("user-runway".getBytes(StandardCharsets.UTF_8),
                WorkspaceCredentialSource.associatedData(workspaceId, "runway"));
        byte[] broken = secret.ciphertext().clone();
        broken[0] ^= 0x01;
        ProviderCredentialEntity entity = ProviderCredentialEntity.create(workspaceId, "runway", Instant.now());
        entity.connect(new EncryptedSecret(broken, secret.wrappedDataKey(), "rotated", secret.nonce(), secret.aad()),
                "****nway", Instant.now());
        when(credentialRepository.findByWorkspaceIdAndProvider(workspaceId, "runway")).thenReturn(Optional.of(entity));

        ResolvedCredential resolved = resolver.resolve("runway", workspaceId).orElseThrow();

        assertThat(resolved.source()).isEqualTo(KeySource.platform);
    }

    @Test
    void repositoryFailureIsTreatedAsMissing() {
        when(credentialRepository.findByWorkspaceIdAndProvider(workspaceId, "runway"))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        ResolvedCredential resolved = resolver.resolve("runway", workspaceId).orElseThrow();

        assertThat(resolved.source()).isEqualTo(KeySource.platform);
    }

    @Test
    void noKeyInEitherTierIsEmpty() {
        when(credentialRepository.findByWorkspaceIdAndProvider(workspaceId, "heygen")).thenReturn(Optional.empty());

        assertThat(resolver.resolve("heygen", workspaceId)).isEmpty();
    }

    @Test
    void resolvedCredentialNeverPrintsTheKey() {
        assertThat(new ResolvedCredential("secret-value", KeySource.user).toString()).doesNotContain("secret-value");
    }

    private ProviderCredentialEntity stored(String provider, String key, CredentialStatus status) {
        EncryptedSecret secret = vault.encrypt(key.getBytes(StandardCharsets.UTF_8),
                WorkspaceCredentialSource.associatedData(workspaceId, provider));
        ProviderCredentialEntity entity = ProviderCredentialEntity.create(workspaceId, provider, Instant.now());
        entity.connect(secret, "****", Instant.now());
        if (status != CredentialStatus.connected) {
            entity.disconnect(Instant.now());
        }
        return entity;
    }
}
