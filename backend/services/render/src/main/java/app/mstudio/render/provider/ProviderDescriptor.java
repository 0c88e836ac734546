package app.mstudio.render.provider;

import java.math.BigDecimal;
import java.util.List;

public record ProviderDescriptor(
        String name,
        String displayName,
        String category,
        List<Integer> supportedDurations,
        List<String> supportedAspectRatios,
        int maxPromptLength,
        BigDecimal costPerSecond,
        boolean requiresApiKey,
        String defaultModel
) {
}
