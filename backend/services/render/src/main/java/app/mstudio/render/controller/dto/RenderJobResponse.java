package app.mstudio.render.controller.dto;

import app.mstudio.render.domain.type.RenderErrorCode;
import app.mstudio.render.domain.type.RenderJobStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * @param videoUrl playable URL; for stored outputs a short-lived link resolved from the media service
 */
public record RenderJobResponse(
        UUID jobId,
        UUID contentId,
        UUID versionId,
        Integer sceneNumber,
        UUID previousJobId,
        RenderJobStatus status,
        Integer progress,
        String progressMessage,
        RenderErrorCode errorCode,
        String errorMessage,
        String provider,
        String providerJobId,
        BigDecimal estimatedCost,
        BigDecimal actualCost,
        Integer retryCount,
        String videoUrl,
        String thumbnailUrl,
        UUID outputMediaId,
        JsonNode storyboard,
        boolean placeholderOutput,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
}
