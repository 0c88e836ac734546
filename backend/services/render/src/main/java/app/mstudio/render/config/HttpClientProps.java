package app.mstudio.render.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.render.http")
public record HttpClientProps(
        Duration connectTimeout,
        Duration readTimeout
) {
    public HttpClientProps {
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(10);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(60);
        }
    }
}
