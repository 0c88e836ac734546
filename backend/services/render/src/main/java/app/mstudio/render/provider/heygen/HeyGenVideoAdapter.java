package app.mstudio.render.provider.heygen;

import app.mstudio.render.provider.ProviderDescriptor;
import app.mstudio.render.provider.ProviderErrorKind;
import app.mstudio.render.provider.ProviderErrors;
import app.mstudio.render.provider.ProviderException;
import app.mstudio.render.provider.ProviderInputs;
import app.mstudio.render.provider.ProviderNames;
import app.mstudio.render.provider.ProviderPollResult;
import app.mstudio.render.provider.ProviderSubmission;
import app.mstudio.render.provider.ProviderSubmitRequest;
import app.mstudio.render.provider.VideoProviderAdapter;
import app.mstudio.render.support.RenderEvents;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Talking-avatar videos. The prompt is the spoken script.
 */
@Component
public class HeyGenVideoAdapter implements VideoProviderAdapter {

    static final int MAX_PROMPT_LENGTH = 5000;

    private static final List<Integer> DURATIONS = List.of(15, 30, 60, 120, 300);
    private static final BigDecimal CREDITS_PER_30S = new BigDecimal("0.5");
    private static final BigDecimal USD_PER_CREDIT = new BigDecimal("0.99");

    private final HeyGenClient client;
    private final HeyGenProps props;
    private final RenderEvents events;

    public HeyGenVideoAdapter(HeyGenClient client, HeyGenProps props, RenderEvents events) {
        this.client = client;
        this.props = props;
        this.events = events;
    }

    @Override
    public String name() {
        return ProviderNames.HEYGEN;
    }

    @Override
    public ProviderDescriptor descriptor() {
        return new ProviderDescriptor(
                name(),
                "HeyGen (Avatar)",
                "avatar",
                DURATIONS,
                List.of("16:9", "9:16", "1:1"),
                MAX_PROMPT_LENGTH,
                CREDITS_PER_30S.multiply(USD_PER_CREDIT).divide(BigDecimal.valueOf(30), 4, RoundingMode.HALF_UP),
                true,
                null
        );
    }

    @Override
    public BigDecimal estimateCost(int durationSeconds, String model) {
        long blocks = (long) Math.ceil(Math.max(durationSeconds, 1) / 30.0);
        return CREDITS_PER_30S
                .multiply(BigDecimal.valueOf(blocks))
                .multiply(USD_PER_CREDIT)
                .setScale(2, RoundingMode.HALF_UP);
    }

    @Override
    public ProviderSubmission submit(ProviderSubmitRequest request) {
        if (props.defaultAvatarId() == null || props.defaultVoiceId() == null) {
            throw new ProviderException(name(), ProviderErrorKind.PAYLOAD,
                    "app.render.providers.heygen.default-avatar-id and default-voice-id are required");
        }
        String script = request.prompt() == null ? "" : request.prompt();
        if (script.length() > MAX_PROMPT_LENGTH) {
            events.warn("HEYGEN:TRUNCATE", "original={} truncated={}", script.length(), MAX_PROMPT_LENGTH);
            script = ProviderInputs.truncate(script, MAX_PROMPT_LENGTH);
        }
        int[] dimensions = dimensions(request.aspectRatio());
        events.info("HEYGEN:SUBMIT", "durationSeconds={} aspectRatio={} promptLength={}",
                request.durationSeconds(), request.aspectRatio(), script.length());

        String finalScript = script;
        String videoId = ProviderErrors.call(name(), "submit", () -> client.generateAvatarVideo(
                request.apiKey(), props.defaultAvatarId(), props.defaultVoiceId(), finalScript, dimensions[0], dimensions[1]));
        if (videoId == null || videoId.isBlank()) {
            throw ProviderErrors.emptyResponse(name(), "submit");
        }
        return ProviderSubmission.accepted(videoId);
    }

    @Override
    public ProviderPollResult poll(String providerJobId, String apiKey) {
        HeyGenVideoStatus status = ProviderErrors.call(name(), "poll", () -> client.getVideoStatus(apiKey, providerJobId));
        if (status == null) {
            throw ProviderErrors.emptyResponse(name(), "poll");
        }
        events.info("HEYGEN:POLL", "providerJobId={} status={}", providerJobId, status.status());
        return switch (status.status()) {
            case "completed" -> ProviderPollResult.completed(status.status(), status.videoUrl(), status.thumbnailUrl());
            case "failed" -> ProviderPollResult.failed(status.status(),
                    status.error() != null ? status.error() : "HeyGen render failed");
            case "processing" -> ProviderPollResult.processing(status.status(), null);
            default -> ProviderPollResult.queued(status.status());
        };
    }

    int[] dimensions(String aspectRatio) {
        String ratio = aspectRatio == null ? "" : aspectRatio.trim();
        switch (ratio) {
            case "16:9":
                return new int[]{1920, 1080};
            case "9:16":
                return new int[]{720, 1280};
            case "1:1":
                return new int[]{1080, 1080};
            default:
                events.warn("HEYGEN:SUBMIT", "unknown aspect ratio {}, using 1920x1080", aspectRatio);
                return new int[]{1920, 1080};
        }
    }
}
