package app.mstudio.render.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param mode           {@code substrate} hands jobs to the durable execution substrate, {@code direct} submits in-process
 * @param directFallback submit directly when the substrate cannot be reached
 */
@ConfigurationProperties(prefix = "app.render.dispatch")
public record DispatchProps(
        String mode,
        boolean directFallback
) {
}
