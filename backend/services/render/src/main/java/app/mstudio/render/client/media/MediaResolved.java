package app.mstudio.render.client.media;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.UUID;

/**
 * A presigned download for a stored render output.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaResolved(
        UUID mediaId,
        String url,
        String mimeType,
        Instant expiresAt
) {
    boolean downloadable() {
        return url != null && !url.isBlank();
    }
}
