package app.mstudio.render.provider.heygen;

public record HeyGenVideoStatus(
        String status,
        String videoUrl,
        String thumbnailUrl,
        String error
) {
}
