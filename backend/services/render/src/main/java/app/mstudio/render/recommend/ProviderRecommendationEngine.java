package app.mstudio.render.recommend;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ranks catalog providers for a render request. Scoring has no side effects: the same context and catalog
 * always produce the same ranking.
 */
@Component
public class ProviderRecommendationEngine {

    private static final double CHANNEL_WEIGHT = 0.6;
    private static final double GOAL_WEIGHT = 0.4;
    private static final double NO_CHANNELS_FIT = 50;
    private static final double GOAL_MATCH = 100;
    private static final double GOAL_MISS = 30;

    private final VideoProviderCatalog catalog;

    public ProviderRecommendationEngine(VideoProviderCatalog catalog) {
        this.catalog = catalog;
    }

    public RecommendationResult recommend(RecommendationContext context) {
        return score(context, catalog.active());
    }

    public static RecommendationResult score(RecommendationContext context, List<VideoProviderMeta> providers) {
        List<String> channels = context.channels().stream()
                .map(channel -> channel.toUpperCase(Locale.ROOT))
                .toList();

        List<ScoredProvider> ranking = new ArrayList<>(providers.size());
        for (VideoProviderMeta provider : providers) {
            ranking.add(scoreOne(provider, channels, context));
        }
        // stable sort keeps catalog order for equal scores
        ranking.sort(Comparator.comparing(ScoredProvider::disqualified)
                .thenComparing(Comparator.comparingInt(ScoredProvider::totalScore).reversed()));

        ScoredProvider recommended = ranking.stream()
                .filter(candidate -> !candidate.disqualified())
                .findFirst()
                .orElse(null);
        boolean fallbackUsed = recommended == null && !ranking.isEmpty();
        if (fallbackUsed) {
            recommended = ranking.get(0);
        }
        return new RecommendationResult(recommended, List.copyOf(ranking), fallbackUsed);
    }

    private static ScoredProvider scoreOne(VideoProviderMeta provider, List<String> channels, RecommendationContext context) {
        QualityTier tier = context.qualityTier();
        List<String> matchingChannels = channels.stream()
                .filter(provider.bestForChannels()::contains)
                .toList();
        boolean goalMatch = context.goal() != null && provider.bestForGoals().contains(context.goal());

        double channelFit = channels.isEmpty() ? NO_CHANNELS_FIT : (double) matchingChannels.size() / channels.size() * 100;
        double goalFit = goalMatch ? GOAL_MATCH : GOAL_MISS;
        double fitScore = channelFit * CHANNEL_WEIGHT + goalFit * GOAL_WEIGHT;

        double quality = provider.qualityScore() * tier.qualityWeight();
        double latency = provider.latencyScore() * tier.latencyWeight();
        double fit = fitScore * tier.fitWeight();

        BigDecimal cost = VideoProviderCatalog.estimateCost(provider, context.durationSeconds());
        BudgetBand band = context.budgetBand();
        boolean withinBudget = band.allows(cost);
        boolean disqualified = !withinBudget;

        return new ScoredProvider(
                provider.id(),
                provider.name(),
                provider.adapter(),
                (int) Math.round(quality + latency + fit),
                (int) Math.round(quality),
                (int) Math.round(latency),
                (int) Math.round(fit),
                cost,
                VideoProviderCatalog.estimateTestRenderCost(provider),
                withinBudget,
                disqualified,
                reason(provider, tier, matchingChannels, goalMatch ? context.goal() : null, cost, withinBudget, band),
                disqualified ? "Estimated cost $" + cost.toPlainString() + " exceeds your " + band.label() + " budget" : null
        );
    }

    private static String reason(VideoProviderMeta provider,
                                 QualityTier tier,
                                 List<String> matchingChannels,
                                 String matchedGoal,
                                 BigDecimal cost,
                                 boolean withinBudget,
                                 BudgetBand band) {
        List<String> parts = new ArrayList<>();
        if (tier == QualityTier.premium && provider.qualityScore() >= 85) {
            parts.add("Premium " + provider.category() + " quality (" + provider.qualityScore() + "/100)");
        } else if (tier == QualityTier.fast && provider.latencyScore() >= 55) {
            parts.add("Fastest generation speed (" + provider.latencyScore() + "/100)");
        } else {
            parts.add(provider.qualityScore() + "/100 quality, " + provider.latencyScore() + "/100 speed");
        }
        if (!matchingChannels.isEmpty()) {
            parts.add("optimized for " + String.join(" + ", matchingChannels));
        }
        if (matchedGoal != null) {
            parts.add("strong for " + matchedGoal + " content");
        }
        if (band.isUnlimited()) {
            parts.add("$" + cost.toPlainString() + " estimated");
        } else if (withinBudget) {
            parts.add("within your " + band.label() + " budget at $" + cost.toPlainString());
        }
        return String.join(" · ", parts);
    }
}
