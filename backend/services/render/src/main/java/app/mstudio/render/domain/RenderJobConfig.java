package app.mstudio.render.domain;

/**
 * Render parameters carried by a job. Scene fields are set only for jobs created from a render plan.
 */
public record RenderJobConfig(
        Integer sceneNumber,
        Integer totalScenes,
        String sceneLabel,
        String aspectRatio,
        Integer durationSeconds,
        String model
) {

    public static RenderJobConfig single(String aspectRatio, Integer durationSeconds, String model) {
        return new RenderJobConfig(null, null, null, aspectRatio, durationSeconds, model);
    }

    public void validate() {
        if (durationSeconds == null || durationSeconds <= 0) {
            throw new IllegalArgumentException("durationSeconds must be positive");
        }
        if (aspectRatio == null || aspectRatio.isBlank()) {
            throw new IllegalArgumentException("aspectRatio is required");
        }
        if (sceneNumber != null) {
            if (sceneNumber < 1) {
                throw new IllegalArgumentException("sceneNumber must start at 1");
            }
            if (totalScenes != null && sceneNumber > totalScenes) {
                throw new IllegalArgumentException("sceneNumber exceeds totalScenes");
            }
        }
    }
}
