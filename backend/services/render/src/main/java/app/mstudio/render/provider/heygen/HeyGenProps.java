package app.mstudio.render.provider.heygen;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.render.providers.heygen")
public record HeyGenProps(
        String baseUrl,
        String defaultAvatarId,
        String defaultVoiceId
) {
    public HeyGenProps {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://api.heygen.com";
        }
    }
}
