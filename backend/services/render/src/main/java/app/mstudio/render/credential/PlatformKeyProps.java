package app.mstudio.render.credential;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

@ConfigurationProperties(prefix = "app.render")
public record PlatformKeyProps(Map<String, String> platformKeys) {
    public PlatformKeyProps {
        platformKeys = platformKeys == null ? Map.of() : Map.copyOf(platformKeys);
    }
}
