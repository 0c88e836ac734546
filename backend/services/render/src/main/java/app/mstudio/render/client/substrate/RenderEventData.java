package app.mstudio.render.client.substrate;

import java.util.UUID;

public record RenderEventData(
        UUID jobId,
        UUID versionId,
        UUID workspaceId,
        String provider,
        String model,
        Integer durationSeconds,
        String aspectRatio,
        Long ledgerEntryId
) {
}
