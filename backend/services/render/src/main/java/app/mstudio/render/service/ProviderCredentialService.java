package app.mstudio.render.service;

import app.mstudio.render.controller.dto.CredentialResponse;
import app.mstudio.render.credential.WorkspaceCredentialSource;
import app.mstudio.render.domain.entity.ProviderCredentialEntity;
import app.mstudio.render.provider.ProviderNames;
import app.mstudio.render.provider.VideoProviderRegistry;
import app.mstudio.render.repository.ProviderCredentialRepository;
import app.mstudio.render.security.CurrentWorkspaceProvider;
import app.mstudio.render.vault.EncryptedSecret;
import app.mstudio.render.vault.SecretVault;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Workspace-owned provider keys. One row per workspace and provider; saving again replaces the key.
 */
@Service
public class ProviderCredentialService {

    private final ProviderCredentialRepository credentialRepository;
    private final CurrentWorkspaceProvider currentWorkspaceProvider;
    private final VideoProviderRegistry providers;
    private final SecretVault secretVault;
    private final Clock clock;

    public ProviderCredentialService(ProviderCredentialRepository credentialRepository,
                                     CurrentWorkspaceProvider currentWorkspaceProvider,
                                     VideoProviderRegistry providers,
                                     SecretVault secretVault,
                                     Clock clock) {
        this.credentialRepository = credentialRepository;
        this.currentWorkspaceProvider = currentWorkspaceProvider;
        this.providers = providers;
        this.secretVault = secretVault;
        this.clock = clock;
    }

    @Transactional
    public CredentialResponse upsert(Jwt jwt, String provider, String apiKey) {
        UUID workspaceId = requireWorkspaceId(jwt);
        String normalized = requireProvider(provider);
        if (apiKey == null || apiKey.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "apiKey is required");
        }

        String secret = apiKey.trim();
        EncryptedSecret encrypted = secretVault.encrypt(
                secret.getBytes(StandardCharsets.UTF_8),
                WorkspaceCredentialSource.associatedData(workspaceId, normalized)
        );
        Instant now = Instant.now(clock);

        ProviderCredentialEntity entity = credentialRepository.findByWorkspaceIdAndProvider(workspaceId, normalized)
                .orElseGet(() -> ProviderCredentialEntity.create(workspaceId, normalized, now));
        entity.connect(encrypted, hint(secret), now);

        return toResponse(credentialRepository.save(entity));
    }

    @Transactional(readOnly = true)
    public List<CredentialResponse> list(Jwt jwt) {
        UUID workspaceId = requireWorkspaceId(jwt);
        return credentialRepository.findByWorkspaceIdOrderByProviderAsc(workspaceId)
                .stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public CredentialResponse get(Jwt jwt, String provider) {
        UUID workspaceId = requireWorkspaceId(jwt);
        String normalized = requireProvider(provider);
        ProviderCredentialEntity entity = credentialRepository.findByWorkspaceIdAndProvider(workspaceId, normalized)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Provider credential not found"));
        return toResponse(entity);
    }

    /**
     * Keeps the row for auditing but stops the resolver from using it.
     */
    @Transactional
    public CredentialResponse disconnect(Jwt jwt, String provider) {
        UUID workspaceId = requireWorkspaceId(jwt);
        String normalized = requireProvider(provider);
        ProviderCredentialEntity entity = credentialRepository.findByWorkspaceIdAndProvider(workspaceId, normalized)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Provider credential not found"));
        entity.disconnect(Instant.now(clock));
        return toResponse(credentialRepository.save(entity));
    }

    private UUID requireWorkspaceId(Jwt jwt) {
        try {
            return currentWorkspaceProvider.requireWorkspaceId(jwt);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, ex.getMessage());
        }
    }

    private String requireProvider(String provider) {
        String normalized = ProviderNames.normalize(provider);
        if (normalized == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Provider is required");
        }
        if (providers.find(normalized).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown video provider: " + provider);
        }
        return normalized;
    }

    private static String hint(String secret) {
        if (secret.length() <= 8) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }

    private CredentialResponse toResponse(ProviderCredentialEntity entity) {
        return new CredentialResponse(
                entity.getId(),
                entity.getProvider(),
                entity.getStatus(),
                entity.getKeyHint(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
