package app.mstudio.render.provider;

public record ProviderSubmitRequest(
        String prompt,
        int durationSeconds,
        String aspectRatio,
        String model,
        String apiKey
) {
    @Override
    public String toString() {
        return "ProviderSubmitRequest[promptLength=" + (prompt == null ? 0 : prompt.length())
                + ", durationSeconds=" + durationSeconds
                + ", aspectRatio=" + aspectRatio
                + ", model=" + model + "]";
    }
}
