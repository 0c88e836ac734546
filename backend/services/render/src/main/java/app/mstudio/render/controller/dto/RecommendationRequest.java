package app.mstudio.render.controller.dto;

import app.mstudio.render.recommend.BudgetBand;
import app.mstudio.render.recommend.QualityTier;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record RecommendationRequest(
        String goal,
        List<String> channels,
        BudgetBand budgetBand,
        QualityTier qualityTier,
        @NotNull @Positive @Max(600) Integer durationSeconds
) {
}
