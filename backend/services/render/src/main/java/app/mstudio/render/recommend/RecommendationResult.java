package app.mstudio.render.recommend;

import java.util.List;

/**
 * @param fallbackUsed every provider is over budget and {@code recommended} is the best of them anyway
 */
public record RecommendationResult(
        ScoredProvider recommended,
        List<ScoredProvider> ranking,
        boolean fallbackUsed
) {
}
