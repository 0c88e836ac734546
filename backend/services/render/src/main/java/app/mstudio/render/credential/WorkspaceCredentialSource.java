package app.mstudio.render.credential;

import app.mstudio.render.domain.entity.ProviderCredentialEntity;
import app.mstudio.render.provider.ProviderNames;
import app.mstudio.render.repository.ProviderCredentialRepository;
import app.mstudio.render.vault.SecretVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

@Component
@Order(1)
public class WorkspaceCredentialSource implements CredentialSource {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceCredentialSource.class);

    private final ProviderCredentialRepository credentialRepository;
    private final SecretVault secretVault;

    public WorkspaceCredentialSource(ProviderCredentialRepository credentialRepository, SecretVault secretVault) {
        this.credentialRepository = credentialRepository;
        this.secretVault = secretVault;
    }

    @Override
    public KeySource source() {
        return KeySource.user;
    }

    @Override
    public Optional<String> find(String provider, UUID workspaceId) {
        if (workspaceId == null) {
            return Optional.empty();
        }
        String normalized = ProviderNames.normalize(provider);
        Optional<ProviderCredentialEntity> stored;
        try {
            stored = credentialRepository.findByWorkspaceIdAndProvider(workspaceId, normalized);
        } catch (DataAccessException ex) {
            log.warn("Workspace credential lookup failed workspaceId={} provider={} error={}",
                    workspaceId, normalized, ex.getClass().getSimpleName());
            return Optional.empty();
        }
        return stored
                .filter(ProviderCredentialEntity::isConnected)
                .flatMap(credential -> decrypt(credential, workspaceId, normalized));
    }

    private Optional<String> decrypt(ProviderCredentialEntity credential, UUID workspaceId, String provider) {
        try {
            byte[] plaintext = secretVault.decrypt(credential.sealedSecret(associatedData(workspaceId, provider)));
            String key = new String(plaintext, StandardCharsets.UTF_8).trim();
            return key.isEmpty() ? Optional.empty() : Optional.of(key);
        } catch (RuntimeException ex) {
            log.warn("Workspace credential could not be decrypted workspaceId={} provider={} keyId={} error={}",
                    workspaceId, provider, credential.getKeyId(), ex.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    public static byte[] associatedData(UUID workspaceId, String provider) {
        return (workspaceId + ":" + provider).getBytes(StandardCharsets.UTF_8);
    }
}
