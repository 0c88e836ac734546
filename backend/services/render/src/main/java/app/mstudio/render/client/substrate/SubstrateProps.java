package app.mstudio.render.client.substrate;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.render.substrate")
public record SubstrateProps(
        String eventUrl,
        String eventKey,
        String eventName
) {
    public SubstrateProps {
        if (eventName == null || eventName.isBlank()) {
            eventName = "studio/video.generate";
        }
    }
}
