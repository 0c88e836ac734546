package app.mstudio.render.dispatch;

import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.domain.type.RenderJobStatus;

import java.util.UUID;

/**
 * Result of one submit or poll step.
 *
 * @param retryable the step hit a transient error and should be called again later
 */
public record StepOutcome(
        UUID jobId,
        RenderJobStatus status,
        boolean retryable,
        String detail
) {

    static StepOutcome of(RenderJobEntity job, String detail) {
        return new StepOutcome(job.getJobId(), job.getStatus(), false, detail);
    }

    static StepOutcome retry(RenderJobEntity job, String detail) {
        return new StepOutcome(job.getJobId(), job.getStatus(), true, detail);
    }

    static StepOutcome missing(UUID jobId) {
        return new StepOutcome(jobId, null, false, "job not found");
    }

    public boolean finished() {
        return status != null && status.isTerminal();
    }
}
