package app.mstudio.render.controller.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record RenderPlanResponse(
        UUID versionId,
        BigDecimal totalEstimatedCost,
        List<PlanSceneResult> scenes
) {
}
