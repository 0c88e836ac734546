package app.mstudio.render.recommend;

import java.math.BigDecimal;

public record ScoredProvider(
        String providerId,
        String providerName,
        String adapter,
        int totalScore,
        int qualityContribution,
        int latencyContribution,
        int fitContribution,
        BigDecimal estimatedCost,
        BigDecimal testRenderCost,
        boolean withinBudget,
        boolean disqualified,
        String reason,
        String disqualifyReason
) {
}
