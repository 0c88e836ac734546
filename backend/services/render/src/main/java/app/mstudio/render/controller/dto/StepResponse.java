package app.mstudio.render.controller.dto;

import app.mstudio.render.domain.type.RenderJobStatus;

import java.util.UUID;

public record StepResponse(
        UUID jobId,
        RenderJobStatus status,
        boolean finished,
        boolean retryable,
        String detail
) {
}
