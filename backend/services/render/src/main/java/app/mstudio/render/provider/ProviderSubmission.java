package app.mstudio.render.provider;

import app.mstudio.render.domain.type.RenderJobStatus;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of a submit call. Synchronous providers return {@link RenderJobStatus#COMPLETED} with their output.
 */
public record ProviderSubmission(
        String providerJobId,
        RenderJobStatus status,
        String outputUrl,
        JsonNode storyboard
) {
    public static ProviderSubmission accepted(String providerJobId) {
        return new ProviderSubmission(providerJobId, RenderJobStatus.QUEUED, null, null);
    }

    public boolean completed() {
        return status == RenderJobStatus.COMPLETED;
    }
}
