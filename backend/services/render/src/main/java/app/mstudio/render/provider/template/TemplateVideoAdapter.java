package app.mstudio.render.provider.template;

import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.provider.ProviderDescriptor;
import app.mstudio.render.provider.ProviderNames;
import app.mstudio.render.provider.ProviderPollResult;
import app.mstudio.render.provider.ProviderSubmission;
import app.mstudio.render.provider.ProviderSubmitRequest;
import app.mstudio.render.provider.VideoProviderAdapter;
import app.mstudio.render.support.RenderEvents;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Zero-cost storyboard renderer. Completes during submit without any remote call.
 */
@Component
public class TemplateVideoAdapter implements VideoProviderAdapter {

    private static final List<String> PALETTE = List.of(
            "#1e293b", "#312e81", "#1e1b4b", "#172554", "#0c4a6e", "#134e4a",
            "#3f3f46", "#581c87", "#7c2d12", "#991b1b", "#065f46", "#713f12"
    );

    private final ObjectMapper objectMapper;
    private final RenderEvents events;

    public TemplateVideoAdapter(ObjectMapper objectMapper, RenderEvents events) {
        this.objectMapper = objectMapper;
        this.events = events;
    }

    @Override
    public String name() {
        return ProviderNames.TEMPLATE;
    }

    @Override
    public ProviderDescriptor descriptor() {
        return new ProviderDescriptor(
                name(),
                "Template (No Cost)",
                "marketing",
                List.of(4, 6, 8, 15, 30, 60),
                List.of("16:9", "9:16", "1:1"),
                10_000,
                BigDecimal.ZERO,
                false,
                null
        );
    }

    @Override
    public BigDecimal estimateCost(int durationSeconds, String model) {
        return BigDecimal.ZERO.setScale(2);
    }

    @Override
    public ProviderSubmission submit(ProviderSubmitRequest request) {
        List<StoryboardFrame> frames = buildFrames(ScriptSceneParser.parse(request.prompt()));
        String jobId = "template-" + UUID.randomUUID();
        events.info("TEMPLATE:SUBMIT", "providerJobId={} durationSeconds={} aspectRatio={} sceneCount={}",
                jobId, request.durationSeconds(), request.aspectRatio(), frames.size());
        return new ProviderSubmission(jobId, RenderJobStatus.COMPLETED, null, objectMapper.valueToTree(frames));
    }

    @Override
    public ProviderPollResult poll(String providerJobId, String apiKey) {
        return ProviderPollResult.completed("completed", null, null);
    }

    static List<StoryboardFrame> buildFrames(List<ScriptSceneParser.Scene> scenes) {
        List<StoryboardFrame> frames = new ArrayList<>(scenes.size());
        for (int i = 0; i < scenes.size(); i++) {
            ScriptSceneParser.Scene scene = scenes.get(i);
            String direction = scene.direction().isEmpty() ? "Scene " + (i + 1) : scene.direction();
            frames.add(new StoryboardFrame(i + 1, scene.text(), direction, PALETTE.get(i % PALETTE.size())));
        }
        return frames;
    }
}
