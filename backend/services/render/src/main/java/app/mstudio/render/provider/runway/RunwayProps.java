package app.mstudio.render.provider.runway;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.render.providers.runway")
public record RunwayProps(
        String baseUrl,
        String apiVersion,
        String defaultModel
) {
    public RunwayProps {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://api.dev.runwayml.com";
        }
        if (apiVersion == null || apiVersion.isBlank()) {
            apiVersion = "2024-11-06";
        }
        if (defaultModel == null || defaultModel.isBlank()) {
            defaultModel = "veo3.1";
        }
    }
}
