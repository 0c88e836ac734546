package app.mstudio.render.client.media;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Media service connection. Render outputs are uploaded under {@code outputKind}.
 */
@ConfigurationProperties(prefix = "app.render.media")
public record MediaClientProps(
        String baseUrl,
        String internalToken,
        String outputKind
) {
    public MediaClientProps {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8084";
        }
        if (outputKind == null || outputKind.isBlank()) {
            outputKind = "render_output";
        }
    }

    public boolean hasInternalToken() {
        return internalToken != null && !internalToken.isBlank();
    }
}
