package app.mstudio.render.credential;

import app.mstudio.render.provider.ProviderNames;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
@Order(2)
public class PlatformCredentialSource implements CredentialSource {

    private final PlatformKeyProps props;

    public PlatformCredentialSource(PlatformKeyProps props) {
        this.props = props;
    }

    @Override
    public KeySource source() {
        return KeySource.platform;
    }

    @Override
    public Optional<String> find(String provider, UUID workspaceId) {
        String key = props.platformKeys().get(ProviderNames.normalize(provider));
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(key.trim());
    }
}
