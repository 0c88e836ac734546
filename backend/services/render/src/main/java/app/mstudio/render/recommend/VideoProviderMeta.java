package app.mstudio.render.recommend;

import java.math.BigDecimal;
import java.util.List;

/**
 * Catalog entry used for recommendations.
 *
 * @param adapter name of the {@code VideoProviderAdapter} that renders for this entry
 */
public record VideoProviderMeta(
        String id,
        String name,
        String adapter,
        String category,
        BigDecimal costPerSecond,
        int minDurationSeconds,
        int maxDurationSeconds,
        int qualityScore,
        int latencyScore,
        List<String> resolutions,
        List<String> bestForChannels,
        List<String> bestForGoals,
        boolean supportsTestRender,
        BigDecimal testRenderCostMultiplier,
        CatalogStatus status,
        String tagline
) {
}
