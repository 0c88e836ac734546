package app.mstudio.render.job;

import app.mstudio.render.domain.RenderJobConfig;

import java.math.BigDecimal;
import java.util.UUID;

public record NewRenderJob(
        UUID workspaceId,
        UUID contentId,
        UUID versionId,
        String provider,
        String prompt,
        RenderJobConfig config,
        BigDecimal estimatedCost
) {
}
