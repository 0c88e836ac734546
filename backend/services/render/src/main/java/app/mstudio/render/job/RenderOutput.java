package app.mstudio.render.job;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

public record RenderOutput(
        String outputUrl,
        String thumbnailUrl,
        UUID mediaId,
        JsonNode storyboard
) {
    public boolean isEmpty() {
        boolean noUrl = outputUrl == null || outputUrl.isBlank();
        boolean noStoryboard = storyboard == null || storyboard.isNull() || storyboard.isEmpty();
        return noUrl && mediaId == null && noStoryboard;
    }
}
