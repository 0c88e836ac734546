package app.mstudio.render.dispatch;

import app.mstudio.render.domain.type.RenderJobStatus;

/**
 * @param accepted the job was handed off and has not failed
 * @param status job status right after the hand-off; {@code null} when the job could not be found
 */
public record DispatchOutcome(
        DispatchMode mode,
        boolean accepted,
        String detail,
        RenderJobStatus status
) {
}
