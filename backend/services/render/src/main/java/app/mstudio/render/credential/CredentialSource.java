package app.mstudio.render.credential;

import java.util.Optional;
import java.util.UUID;

/**
 * One tier of key lookup. Implementations never throw for a missing or unreadable key.
 */
public interface CredentialSource {

    KeySource source();

    Optional<String> find(String provider, UUID workspaceId);
}
