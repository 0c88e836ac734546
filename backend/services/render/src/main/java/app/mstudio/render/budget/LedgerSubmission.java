package app.mstudio.render.budget;

import java.math.BigDecimal;
import java.util.UUID;

public record LedgerSubmission(
        UUID workspaceId,
        UUID jobId,
        String provider,
        String providerJobId,
        int durationSeconds,
        String aspectRatio,
        int promptLength,
        BigDecimal estimatedCostUsd
) {
}
