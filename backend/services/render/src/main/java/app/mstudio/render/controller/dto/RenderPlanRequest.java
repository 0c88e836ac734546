package app.mstudio.render.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record RenderPlanRequest(
        UUID contentId,
        @NotNull UUID versionId,
        @NotBlank String provider,
        String aspectRatio,
        String model,
        @NotEmpty @Size(max = 24) List<@Valid PlanScene> scenes
) {
}
