package app.mstudio.render.dispatch;

import app.mstudio.render.client.substrate.ExecutionSubstrateClient;
import app.mstudio.render.client.substrate.RenderEventData;
import app.mstudio.render.config.DispatchProps;
import app.mstudio.render.domain.RenderJobConfig;
import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.domain.type.RenderErrorCode;
import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.job.RenderJobLifecycleManager;
import app.mstudio.render.support.RenderEvents;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

/**
 * Publishes the job to the execution substrate. When the substrate cannot be reached the job is either
 * submitted directly or failed, depending on {@code app.render.dispatch.direct-fallback}.
 */
@Component
@Primary
@ConditionalOnProperty(name = "app.render.dispatch.mode", havingValue = "substrate", matchIfMissing = true)
public class SubstrateDispatcher implements RenderDispatcher {

    private final ExecutionSubstrateClient substrateClient;
    private final DirectDispatcher directDispatcher;
    private final RenderJobLifecycleManager lifecycle;
    private final DispatchProps props;
    private final RenderEvents events;

    public SubstrateDispatcher(ExecutionSubstrateClient substrateClient,
                               DirectDispatcher directDispatcher,
                               RenderJobLifecycleManager lifecycle,
                               DispatchProps props,
                               RenderEvents events) {
        this.substrateClient = substrateClient;
        this.directDispatcher = directDispatcher;
        this.lifecycle = lifecycle;
        this.props = props;
        this.events = events;
    }

    @Override
    public DispatchOutcome dispatch(RenderJobEntity job) {
        RenderJobConfig config = job.getConfig();
        RenderEventData data = new RenderEventData(
                job.getJobId(),
                job.getVersionId(),
                job.getWorkspaceId(),
                job.getProvider(),
                config.model(),
                config.durationSeconds(),
                config.aspectRatio(),
                job.getLedgerEntryId()
        );
        try {
            substrateClient.send(data);
            events.info("DISPATCH:OK", "jobId={} mode=substrate provider={}", job.getJobId(), job.getProvider());
            return new DispatchOutcome(DispatchMode.SUBSTRATE, true, "event sent", job.getStatus());
        } catch (RestClientException | IllegalStateException ex) {
            String reason = RenderEvents.safeMessage(ex, 300);
            events.warn("DISPATCH:FAIL", "jobId={} directFallback={} error={}", job.getJobId(), props.directFallback(), reason);
            if (props.directFallback()) {
                return directDispatcher.dispatch(job);
            }
            lifecycle.fail(job, RenderErrorCode.DISPATCH_FAILED, "Could not dispatch render job: " + reason);
            return new DispatchOutcome(DispatchMode.SUBSTRATE, false, reason, RenderJobStatus.FAILED);
        }
    }
}
