package app.mstudio.render.client.media;

import java.util.UUID;

/**
 * Multipart "meta" part of an internal upload. The owner is the workspace that paid for the render.
 */
public record MediaDirectUploadRequest(
        String kind,
        String contentType,
        String fileName,
        UUID ownerWorkspaceId,
        UUID renderJobId
) {
}
