package app.mstudio.render.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * @param token shared bearer token the execution substrate presents on step callbacks
 */
@ConfigurationProperties(prefix = "app.internal")
public record InternalAuthProps(
        String token
) {

    public boolean enabled() {
        return token != null && !token.isBlank();
    }

    /**
     * Constant-time comparison against the configured token. Always false while internal access is disabled.
     */
    public boolean accepts(String presented) {
        if (!enabled() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }
}
