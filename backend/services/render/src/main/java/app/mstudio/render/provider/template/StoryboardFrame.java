package app.mstudio.render.provider.template;

public record StoryboardFrame(
        int sceneNumber,
        String text,
        String direction,
        String backgroundColor
) {
}
