package app.mstudio.render.provider;

import java.math.BigDecimal;

/**
 * Uniform contract over an external video generation service.
 * <p>
 * Implementations normalize inputs instead of rejecting them: overlong prompts are truncated, durations are
 * snapped to the nearest allowed value and unknown aspect ratios fall back to the provider default. Remote
 * failures surface as {@link ProviderException}.
 */
public interface VideoProviderAdapter {

    String name();

    ProviderDescriptor descriptor();

    BigDecimal estimateCost(int durationSeconds, String model);

    ProviderSubmission submit(ProviderSubmitRequest request);

    ProviderPollResult poll(String providerJobId, String apiKey);

    /**
     * Fetches binary output for providers whose completed result sits behind authentication.
     */
    default byte[] download(String providerJobId, String apiKey) {
        throw new UnsupportedOperationException(name() + " does not serve authenticated downloads");
    }
}
