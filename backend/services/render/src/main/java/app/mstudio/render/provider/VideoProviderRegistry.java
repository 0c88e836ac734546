package app.mstudio.render.provider;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class VideoProviderRegistry {

    private final Map<String, VideoProviderAdapter> adapters;

    public VideoProviderRegistry(List<VideoProviderAdapter> adapters) {
        this.adapters = adapters.stream()
                .collect(Collectors.toMap(VideoProviderAdapter::name, Function.identity(), (first, second) -> first));
    }

    public Optional<VideoProviderAdapter> find(String provider) {
        String normalized = ProviderNames.normalize(provider);
        return normalized == null ? Optional.empty() : Optional.ofNullable(adapters.get(normalized));
    }

    public VideoProviderAdapter require(String provider) {
        return find(provider)
                .orElseThrow(() -> new IllegalArgumentException("Unknown video provider: " + provider));
    }

    public List<ProviderDescriptor> descriptors() {
        return adapters.values().stream()
                .map(VideoProviderAdapter::descriptor)
                .sorted(Comparator.comparing(ProviderDescriptor::name))
                .toList();
    }
}
