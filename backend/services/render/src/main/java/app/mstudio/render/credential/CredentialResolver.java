package app.mstudio.render.credential;

import app.mstudio.render.provider.ProviderNames;
import app.mstudio.render.support.RenderEvents;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the API key for a provider call. The workspace's own key wins over the platform key; an empty
 * result means neither tier has one.
 */
@Service
public class CredentialResolver {

    private final List<CredentialSource> sources;
    private final RenderEvents events;

    public CredentialResolver(List<CredentialSource> sources, RenderEvents events) {
        this.sources = List.copyOf(sources);
        this.events = events;
    }

    public Optional<ResolvedCredential> resolve(String provider, UUID workspaceId) {
        String normalized = ProviderNames.normalize(provider);
        for (CredentialSource source : sources) {
            Optional<String> key = source.find(normalized, workspaceId);
            if (key.isPresent()) {
                events.info("KEYS", "provider={} workspaceId={} source={}", normalized, workspaceId, source.source());
                return Optional.of(new ResolvedCredential(key.get(), source.source()));
            }
        }
        events.warn("KEYS", "provider={} workspaceId={} source=none", normalized, workspaceId);
        return Optional.empty();
    }
}
