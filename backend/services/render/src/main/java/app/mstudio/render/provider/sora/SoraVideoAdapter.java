package app.mstudio.render.provider.sora;

import app.mstudio.render.provider.ProviderDescriptor;
import app.mstudio.render.provider.ProviderErrors;
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
import java.util.Map;

@Component
public class SoraVideoAdapter implements VideoProviderAdapter {

    static final int MAX_PROMPT_LENGTH = 5000;
    static final String PRO_MODEL = "sora-2-pro";
    static final String DEFAULT_SIZE = "1280x720";

    private static final List<Integer> STANDARD_DURATIONS = List.of(4, 8, 12);
    private static final List<Integer> PRO_DURATIONS = List.of(10, 15, 25);
    private static final BigDecimal STANDARD_RATE = new BigDecimal("0.10");
    private static final BigDecimal PRO_RATE = new BigDecimal("0.30");
    private static final Map<String, String> SIZES = Map.of(
            "16:9", "1280x720",
            "9:16", "720x1280",
            "1:1", "1024x1024",
            "21:9", "1792x1024",
            "9:21", "1024x1792",
            "1280x720", "1280x720",
            "720x1280", "720x1280",
            "1024x1024", "1024x1024",
            "1792x1024", "1792x1024",
            "1024x1792", "1024x1792"
    );

    private final SoraClient client;
    private final SoraProps props;
    private final RenderEvents events;

    public SoraVideoAdapter(SoraClient client, SoraProps props, RenderEvents events) {
        this.client = client;
        this.props = props;
        this.events = events;
    }

    @Override
    public String name() {
        return ProviderNames.SORA;
    }

    @Override
    public ProviderDescriptor descriptor() {
        return new ProviderDescriptor(
                name(),
                "OpenAI Sora 2",
                "cinematic",
                STANDARD_DURATIONS,
                List.of("16:9", "9:16", "1:1", "21:9"),
                MAX_PROMPT_LENGTH,
                STANDARD_RATE,
                true,
                props.defaultModel()
        );
    }

    @Override
    public BigDecimal estimateCost(int durationSeconds, String model) {
        boolean pro = isPro(model);
        int duration = ProviderInputs.snapDuration(durationSeconds, pro ? PRO_DURATIONS : STANDARD_DURATIONS);
        return (pro ? PRO_RATE : STANDARD_RATE)
                .multiply(BigDecimal.valueOf(duration))
                .setScale(2, RoundingMode.HALF_UP);
    }

    @Override
    public ProviderSubmission submit(ProviderSubmitRequest request) {
        String model = request.model() == null || request.model().isBlank() ? props.defaultModel() : request.model();
        String prompt = request.prompt() == null ? "" : request.prompt();
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            events.warn("SORA:TRUNCATE", "original={} truncated={}", prompt.length(), MAX_PROMPT_LENGTH);
            prompt = ProviderInputs.truncate(prompt, MAX_PROMPT_LENGTH);
        }
        String size = mapSize(request.aspectRatio());
        int seconds = ProviderInputs.snapDuration(request.durationSeconds(), isPro(model) ? PRO_DURATIONS : STANDARD_DURATIONS);
        events.info("SORA:SUBMIT", "model={} size={} seconds={} promptLength={}", model, size, seconds, prompt.length());

        String finalPrompt = prompt;
        SoraVideoJob job = ProviderErrors.call(name(), "submit",
                () -> client.createVideo(request.apiKey(), model, finalPrompt, size, seconds));
        if (job == null || job.id() == null || job.id().isBlank()) {
            throw ProviderErrors.emptyResponse(name(), "submit");
        }
        events.info("SORA:SUBMIT", "accepted providerJobId={}", job.id());
        return ProviderSubmission.accepted(job.id());
    }

    @Override
    public ProviderPollResult poll(String providerJobId, String apiKey) {
        SoraVideoJob job = ProviderErrors.call(name(), "poll", () -> client.getVideo(apiKey, providerJobId));
        if (job == null) {
            throw ProviderErrors.emptyResponse(name(), "poll");
        }
        events.info("SORA:POLL", "providerJobId={} status={} progress={}", providerJobId, job.status(), job.progress());
        return switch (job.status()) {
            case "queued" -> ProviderPollResult.queued(job.status());
            case "completed" -> ProviderPollResult.completedWithDownload(job.status(), client.contentUrl(providerJobId));
            case "failed" -> ProviderPollResult.failed(job.status(),
                    job.error() != null ? job.error() : "Sora generation failed");
            default -> ProviderPollResult.processing(job.status(), job.progress());
        };
    }

    @Override
    public byte[] download(String providerJobId, String apiKey) {
        byte[] content = ProviderErrors.call(name(), "download", () -> client.downloadContent(apiKey, providerJobId));
        if (content == null || content.length == 0) {
            throw ProviderErrors.emptyResponse(name(), "download");
        }
        events.info("SORA:DOWNLOAD", "providerJobId={} bytes={}", providerJobId, content.length);
        return content;
    }

    String mapSize(String aspectRatio) {
        String mapped = aspectRatio == null ? null : SIZES.get(aspectRatio.trim());
        if (mapped == null) {
            events.warn("SORA:SUBMIT", "unknown aspect ratio {}, using {}", aspectRatio, DEFAULT_SIZE);
            return DEFAULT_SIZE;
        }
        return mapped;
    }

    private static boolean isPro(String model) {
        return PRO_MODEL.equalsIgnoreCase(model);
    }
}
