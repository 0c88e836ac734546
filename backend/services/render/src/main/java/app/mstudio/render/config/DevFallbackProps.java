package app.mstudio.render.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.render.dev-fallback")
public record DevFallbackProps(
        boolean enabled,
        String placeholderUrl
) {
}
