package app.mstudio.render.security;

import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class CurrentWorkspaceProvider {

    public Optional<UUID> getWorkspaceId(Jwt jwt) {
        if (jwt == null) {
            return Optional.empty();
        }
        String claim = jwt.getClaimAsString("workspace_id");
        if (claim == null || claim.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(claim));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    public UUID requireWorkspaceId(Jwt jwt) {
        return getWorkspaceId(jwt)
                .orElseThrow(() -> new IllegalStateException("workspace_id claim missing"));
    }
}
