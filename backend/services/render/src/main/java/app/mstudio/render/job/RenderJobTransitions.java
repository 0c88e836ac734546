package app.mstudio.render.job;

import app.mstudio.render.domain.type.RenderJobStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed job status changes. Terminal states are final except for an explicit retry of a failed job.
 */
public final class RenderJobTransitions {

    private static final Map<RenderJobStatus, Set<RenderJobStatus>> ALLOWED = new EnumMap<>(RenderJobStatus.class);

    static {
        ALLOWED.put(RenderJobStatus.QUEUED, EnumSet.of(RenderJobStatus.PROCESSING, RenderJobStatus.FAILED));
        ALLOWED.put(RenderJobStatus.PROCESSING, EnumSet.of(RenderJobStatus.COMPLETED, RenderJobStatus.FAILED));
        ALLOWED.put(RenderJobStatus.COMPLETED, EnumSet.noneOf(RenderJobStatus.class));
        ALLOWED.put(RenderJobStatus.FAILED, EnumSet.of(RenderJobStatus.QUEUED));
    }

    private RenderJobTransitions() {
    }

    public static boolean isAllowed(RenderJobStatus from, RenderJobStatus to) {
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }

    public static void require(RenderJobStatus from, RenderJobStatus to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException("Illegal render job transition " + from + " -> " + to);
        }
    }
}
