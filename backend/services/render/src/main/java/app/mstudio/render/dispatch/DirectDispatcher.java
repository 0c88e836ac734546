package app.mstudio.render.dispatch;

import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.support.RenderEvents;
import org.springframework.stereotype.Component;

/**
 * Submits in-process. Polling is then left to {@link RenderPollWorker}.
 */
@Component
public class DirectDispatcher implements RenderDispatcher {

    private final RenderStepExecutor stepExecutor;
    private final RenderEvents events;

    public DirectDispatcher(RenderStepExecutor stepExecutor, RenderEvents events) {
        this.stepExecutor = stepExecutor;
        this.events = events;
    }

    @Override
    public DispatchOutcome dispatch(RenderJobEntity job) {
        StepOutcome outcome = stepExecutor.submit(job.getJobId());
        events.info("DISPATCH:OK", "jobId={} mode=direct status={} detail={}",
                job.getJobId(), outcome.status(), outcome.detail());
        boolean accepted = outcome.status() != null && outcome.status() != RenderJobStatus.FAILED;
        return new DispatchOutcome(DispatchMode.DIRECT, accepted, outcome.detail(), outcome.status());
    }
}
