package app.mstudio.render.recommend;

import app.mstudio.render.provider.ProviderNames;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

@Component
public class VideoProviderCatalog {

    private static final int TEST_RENDER_SECONDS = 10;

    private static final List<VideoProviderMeta> ENTRIES = List.of(
            new VideoProviderMeta(
                    "runway-gen4",
                    "Runway Gen-4.5",
                    ProviderNames.RUNWAY,
                    "cinematic",
                    new BigDecimal("0.34"),
                    4,
                    16,
                    92,
                    45,
                    List.of("720p", "1080p"),
                    List.of("YOUTUBE", "LINKEDIN", "INSTAGRAM"),
                    List.of("authority", "awareness"),
                    true,
                    BigDecimal.ONE,
                    CatalogStatus.active,
                    "Cinematic AI video, Hollywood quality"
            ),
            new VideoProviderMeta(
                    "sora-2",
                    "Sora 2",
                    ProviderNames.SORA,
                    "cinematic",
                    new BigDecimal("0.10"),
                    4,
                    20,
                    85,
                    60,
                    List.of("720p", "1080p", "4K"),
                    List.of("YOUTUBE", "TIKTOK", "INSTAGRAM"),
                    List.of("awareness", "conversion", "education"),
                    true,
                    BigDecimal.ONE,
                    CatalogStatus.active,
                    "OpenAI video generation, fast and versatile"
            )
    );

    private final List<VideoProviderMeta> entries;

    public VideoProviderCatalog() {
        this(ENTRIES);
    }

    public VideoProviderCatalog(List<VideoProviderMeta> entries) {
        this.entries = List.copyOf(entries);
    }

    public List<VideoProviderMeta> all() {
        return entries;
    }

    public List<VideoProviderMeta> active() {
        return entries.stream()
                .filter(entry -> entry.status() == CatalogStatus.active)
                .toList();
    }

    public Optional<VideoProviderMeta> find(String id) {
        return entries.stream().filter(entry -> entry.id().equals(id)).findFirst();
    }

    /**
     * Rate times duration clamped to the provider's range, rounded to cents.
     */
    public static BigDecimal estimateCost(VideoProviderMeta provider, int durationSeconds) {
        int clamped = Math.max(provider.minDurationSeconds(), Math.min(provider.maxDurationSeconds(), durationSeconds));
        return provider.costPerSecond()
                .multiply(BigDecimal.valueOf(clamped))
                .setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal estimateTestRenderCost(VideoProviderMeta provider) {
        if (!provider.supportsTestRender()) {
            return BigDecimal.ZERO.setScale(2);
        }
        int seconds = Math.min(TEST_RENDER_SECONDS, provider.maxDurationSeconds());
        return provider.costPerSecond()
                .multiply(BigDecimal.valueOf(seconds))
                .multiply(provider.testRenderCostMultiplier())
                .setScale(2, RoundingMode.HALF_UP);
    }
}
