package app.mstudio.render.controller.dto;

import app.mstudio.render.domain.type.CredentialStatus;

import java.time.Instant;
import java.util.UUID;

public record CredentialResponse(
        UUID id,
        String provider,
        CredentialStatus status,
        String keyHint,
        Instant createdAt,
        Instant updatedAt
) {
}
