package app.mstudio.render.provider.sora;

public record SoraVideoJob(
        String id,
        String status,
        Integer progress,
        String model,
        String error
) {
}
