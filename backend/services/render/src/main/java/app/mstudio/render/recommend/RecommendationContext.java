package app.mstudio.render.recommend;

import java.util.List;

public record RecommendationContext(
        String goal,
        List<String> channels,
        BudgetBand budgetBand,
        QualityTier qualityTier,
        int durationSeconds
) {
    public RecommendationContext {
        channels = channels == null ? List.of() : List.copyOf(channels);
        if (budgetBand == null) {
            budgetBand = BudgetBand.UNLIMITED;
        }
        if (qualityTier == null) {
            qualityTier = QualityTier.balanced;
        }
    }
}
