package app.mstudio.render.controller;

import app.mstudio.render.controller.dto.RecommendationRequest;
import app.mstudio.render.provider.ProviderDescriptor;
import app.mstudio.render.provider.VideoProviderRegistry;
import app.mstudio.render.recommend.ProviderRecommendationEngine;
import app.mstudio.render.recommend.RecommendationContext;
import app.mstudio.render.recommend.RecommendationResult;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class ProviderController {

    private final VideoProviderRegistry registry;
    private final ProviderRecommendationEngine recommendationEngine;

    public ProviderController(VideoProviderRegistry registry, ProviderRecommendationEngine recommendationEngine) {
        this.registry = registry;
        this.recommendationEngine = recommendationEngine;
    }

    @GetMapping("/providers")
    public List<ProviderDescriptor> providers() {
        return registry.descriptors();
    }

    @PostMapping("/recommendations")
    public RecommendationResult recommend(@Valid @RequestBody RecommendationRequest request) {
        return recommendationEngine.recommend(new RecommendationContext(
                request.goal(),
                request.channels(),
                request.budgetBand(),
                request.qualityTier(),
                request.durationSeconds()
        ));
    }
}
