package app.mstudio.render.provider;

import java.util.List;

/**
 * Input normalization shared by adapters.
 */
public final class ProviderInputs {

    private ProviderInputs() {
    }

    /**
     * Smallest allowed duration that is at least the requested one, or the longest allowed duration.
     */
    public static int snapDuration(int requested, List<Integer> allowed) {
        int longest = allowed.get(0);
        for (int candidate : allowed) {
            if (requested <= candidate) {
                return candidate;
            }
            longest = Math.max(longest, candidate);
        }
        return longest;
    }

    public static String truncate(String prompt, int maxLength) {
        if (prompt == null) {
            return "";
        }
        return prompt.length() > maxLength ? prompt.substring(0, maxLength) : prompt;
    }
}
