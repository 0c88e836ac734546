package app.mstudio.render.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Browser access for the studio front end. Render endpoints only need the verbs below.
 */
@ConfigurationProperties(prefix = "app.cors")
public record CorsProps(
        List<String> origins,
        List<String> methods,
        Duration maxAge
) {
    public CorsProps {
        origins = origins == null || origins.isEmpty() ? List.of("http://localhost:3000") : List.copyOf(origins);
        methods = methods == null || methods.isEmpty()
                ? List.of("GET", "POST", "PUT", "DELETE", "OPTIONS")
                : List.copyOf(methods);
        maxAge = maxAge == null ? Duration.ofHours(1) : maxAge;
    }
}
