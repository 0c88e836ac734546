package app.mstudio.render.provider.sora;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.render.providers.sora")
public record SoraProps(
        String baseUrl,
        String defaultModel
) {
    public SoraProps {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://api.openai.com";
        }
        if (defaultModel == null || defaultModel.isBlank()) {
            defaultModel = "sora-2";
        }
    }
}
