package app.mstudio.render.provider;

import app.mstudio.render.domain.type.RenderJobStatus;

/**
 * Vendor task state normalized to the job status vocabulary.
 *
 * @param requiresDownload the output must be fetched with the provider key and stored before completion
 */
public record ProviderPollResult(
        RenderJobStatus status,
        String providerStatus,
        Integer progress,
        String outputUrl,
        String thumbnailUrl,
        boolean requiresDownload,
        String errorMessage
) {

    public static ProviderPollResult queued(String providerStatus) {
        return new ProviderPollResult(RenderJobStatus.QUEUED, providerStatus, 0, null, null, false, null);
    }

    public static ProviderPollResult processing(String providerStatus, Integer progress) {
        return new ProviderPollResult(RenderJobStatus.PROCESSING, providerStatus, progress, null, null, false, null);
    }

    public static ProviderPollResult completed(String providerStatus, String outputUrl, String thumbnailUrl) {
        return new ProviderPollResult(RenderJobStatus.COMPLETED, providerStatus, 100, outputUrl, thumbnailUrl, false, null);
    }

    public static ProviderPollResult completedWithDownload(String providerStatus, String contentUrl) {
        return new ProviderPollResult(RenderJobStatus.COMPLETED, providerStatus, 100, contentUrl, null, true, null);
    }

    public static ProviderPollResult failed(String providerStatus, String errorMessage) {
        return new ProviderPollResult(RenderJobStatus.FAILED, providerStatus, null, null, null, false, errorMessage);
    }
}
