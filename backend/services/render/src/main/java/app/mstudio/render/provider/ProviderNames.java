package app.mstudio.render.provider;

import java.util.Locale;

public final class ProviderNames {

    public static final String RUNWAY = "runway";
    public static final String SORA = "sora";
    public static final String HEYGEN = "heygen";
    public static final String TEMPLATE = "template";

    private ProviderNames() {
    }

    /**
     * Maps vendor and catalog aliases to the adapter name, e.g. {@code openai} and {@code sora-2} to {@code sora}.
     */
    public static String normalize(String provider) {
        if (provider == null || provider.isBlank()) {
            return null;
        }
        String value = provider.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("runway")) {
            return RUNWAY;
        }
        if (value.startsWith("sora") || value.equals("openai")) {
            return SORA;
        }
        if (value.startsWith("heygen")) {
            return HEYGEN;
        }
        if (value.equals("storyboard")) {
            return TEMPLATE;
        }
        return value;
    }

    /**
     * Name of the environment variable that carries the platform key, used in configuration error messages.
     */
    public static String platformKeyVariable(String provider) {
        String normalized = normalize(provider);
        if (SORA.equals(normalized)) {
            return "OPENAI_API_KEY";
        }
        return normalized == null ? "API_KEY" : normalized.toUpperCase(Locale.ROOT) + "_API_KEY";
    }
}
