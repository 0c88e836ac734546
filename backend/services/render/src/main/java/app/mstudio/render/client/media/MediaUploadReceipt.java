package app.mstudio.render.client.media;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaUploadReceipt(
        UUID mediaId,
        String status,
        Long sizeBytes
) {
    boolean accepted() {
        return mediaId != null && !"rejected".equalsIgnoreCase(status);
    }
}
