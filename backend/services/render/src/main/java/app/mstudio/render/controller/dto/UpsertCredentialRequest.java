package app.mstudio.render.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpsertCredentialRequest(
        @NotBlank @Size(max = 4096) String apiKey
) {
    @Override
    public String toString() {
        return "UpsertCredentialRequest[apiKey=****]";
    }
}
