package app.mstudio.render.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record EstimateRequest(
        @NotBlank String provider,
        @NotNull @Positive @Max(600) Integer durationSeconds,
        String model
) {
}
