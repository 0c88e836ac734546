package app.mstudio.render.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record PlanScene(
        String label,
        @NotBlank @Size(max = 20000) String prompt,
        @NotNull @Positive @Max(600) Integer durationSeconds
) {
}
