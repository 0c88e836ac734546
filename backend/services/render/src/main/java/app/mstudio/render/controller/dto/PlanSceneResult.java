package app.mstudio.render.controller.dto;

import app.mstudio.render.domain.type.RenderJobStatus;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * @param error why the scene was not dispatched; {@code null} when it was
 */
public record PlanSceneResult(
        int sceneNumber,
        UUID jobId,
        RenderJobStatus status,
        BigDecimal estimatedCost,
        boolean dispatched,
        String error
) {
}
