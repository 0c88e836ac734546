package app.mstudio.render.provider.runway;

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
import java.util.Locale;
import java.util.Map;

@Component
public class RunwayVideoAdapter implements VideoProviderAdapter {

    static final int MAX_PROMPT_LENGTH = 1000;
    static final List<Integer> DURATIONS = List.of(4, 6, 8);
    static final String DEFAULT_RATIO = "1280:720";

    private static final int CREDITS_PER_SECOND = 40;
    private static final BigDecimal USD_PER_CREDIT = new BigDecimal("0.0085");
    private static final Map<String, String> RATIOS = Map.of(
            "16:9", "1280:720",
            "9:16", "720:1280",
            "1:1", "1080:1080",
            "1280:720", "1280:720",
            "720:1280", "720:1280",
            "1080:1080", "1080:1080"
    );

    private final RunwayClient client;
    private final RunwayProps props;
    private final RenderEvents events;

    public RunwayVideoAdapter(RunwayClient client, RunwayProps props, RenderEvents events) {
        this.client = client;
        this.props = props;
        this.events = events;
    }

    @Override
    public String name() {
        return ProviderNames.RUNWAY;
    }

    @Override
    public ProviderDescriptor descriptor() {
        return new ProviderDescriptor(
                name(),
                "Runway",
                "cinematic",
                DURATIONS,
                List.of("16:9", "9:16", "1:1"),
                MAX_PROMPT_LENGTH,
                USD_PER_CREDIT.multiply(BigDecimal.valueOf(CREDITS_PER_SECOND)),
                true,
                props.defaultModel()
        );
    }

    @Override
    public BigDecimal estimateCost(int durationSeconds, String model) {
        int duration = ProviderInputs.snapDuration(durationSeconds, DURATIONS);
        return USD_PER_CREDIT
                .multiply(BigDecimal.valueOf((long) CREDITS_PER_SECOND * duration))
                .setScale(2, RoundingMode.HALF_UP);
    }

    @Override
    public ProviderSubmission submit(ProviderSubmitRequest request) {
        String prompt = request.prompt() == null ? "" : request.prompt();
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            events.warn("RUNWAY:TRUNCATE", "original={} truncated={}", prompt.length(), MAX_PROMPT_LENGTH);
            prompt = ProviderInputs.truncate(prompt, MAX_PROMPT_LENGTH);
        }
        String model = request.model() == null || request.model().isBlank() ? props.defaultModel() : request.model();
        String ratio = mapRatio(request.aspectRatio());
        int duration = ProviderInputs.snapDuration(request.durationSeconds(), DURATIONS);
        events.info("RUNWAY:SUBMIT", "model={} ratio={} duration={} promptLength={}", model, ratio, duration, prompt.length());

        String promptText = prompt;
        String taskId = ProviderErrors.call(name(), "submit",
                () -> client.createTextToVideo(request.apiKey(), model, promptText, ratio, duration));
        if (taskId == null || taskId.isBlank()) {
            throw ProviderErrors.emptyResponse(name(), "submit");
        }
        events.info("RUNWAY:SUBMIT", "accepted providerJobId={}", taskId);
        return ProviderSubmission.accepted(taskId);
    }

    @Override
    public ProviderPollResult poll(String providerJobId, String apiKey) {
        RunwayTask task = ProviderErrors.call(name(), "poll", () -> client.getTask(apiKey, providerJobId));
        if (task == null) {
            throw ProviderErrors.emptyResponse(name(), "poll");
        }
        String status = task.status().toUpperCase(Locale.ROOT);
        events.info("RUNWAY:POLL", "providerJobId={} status={} progress={}", providerJobId, status, task.progress());
        return switch (status) {
            case "PENDING", "THROTTLED" -> ProviderPollResult.queued(status);
            case "SUCCEEDED" -> {
                String outputUrl = task.output().isEmpty() ? null : task.output().get(0);
                if (outputUrl == null) {
                    events.warn("RUNWAY:POLL", "providerJobId={} succeeded without output", providerJobId);
                }
                yield ProviderPollResult.completed(status, outputUrl, task.thumbnail());
            }
            case "FAILED", "CANCELLED" -> ProviderPollResult.failed(status,
                    task.failure() != null ? task.failure() : "Runway task " + status.toLowerCase(Locale.ROOT));
            default -> ProviderPollResult.processing(status, toPercent(task.progress()));
        };
    }

    String mapRatio(String aspectRatio) {
        String mapped = aspectRatio == null ? null : RATIOS.get(aspectRatio.trim());
        if (mapped == null) {
            events.warn("RUNWAY:SUBMIT", "unknown aspect ratio {}, using {}", aspectRatio, DEFAULT_RATIO);
            return DEFAULT_RATIO;
        }
        return mapped;
    }

    // Runway reports progress as a fraction
    private static Integer toPercent(Double progress) {
        if (progress == null) {
            return null;
        }
        double percent = progress <= 1.0 ? progress * 100 : progress;
        return (int) Math.max(0, Math.min(99, Math.round(percent)));
    }
}
