package app.mstudio.render.service;

import app.mstudio.render.budget.BudgetCheckResult;
import app.mstudio.render.budget.LedgerSubmission;
import app.mstudio.render.budget.RenderBudgetService;
import app.mstudio.render.client.media.MediaApiClient;
import app.mstudio.render.client.media.MediaResolved;
import app.mstudio.render.controller.dto.EstimateRequest;
import app.mstudio.render.controller.dto.EstimateResponse;
import app.mstudio.render.controller.dto.RenderJobResponse;
import app.mstudio.render.controller.dto.StartRenderRequest;
import app.mstudio.render.dispatch.RenderDispatcher;
import app.mstudio.render.domain.RenderJobConfig;
import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.domain.type.RenderErrorCode;
import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.job.JobAdmission;
import app.mstudio.render.job.NewRenderJob;
import app.mstudio.render.job.RenderJobLifecycleManager;
import app.mstudio.render.provider.VideoProviderAdapter;
import app.mstudio.render.repository.RenderJobRepository;
import app.mstudio.render.support.RenderEvents;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for single renders: budget, credential, job, ledger, dispatch, in that order.
 * <p>
 * Not transactional as a whole. Each step commits on its own so no database transaction stays open while a
 * provider or the substrate is called.
 */
@Service
public class RenderOrchestrationService {

    static final String NO_OUTPUT_MESSAGE = "Render completed but no output was stored.";
    static final String UNKNOWN_FAILURE_MESSAGE = "Render failed without an error message.";

    private final RenderPreflight preflight;
    private final RenderJobRepository jobRepository;
    private final RenderJobLifecycleManager lifecycle;
    private final RenderBudgetService budgetService;
    private final RenderDispatcher dispatcher;
    private final MediaApiClient mediaApiClient;
    private final RenderEvents events;

    public RenderOrchestrationService(RenderPreflight preflight,
                                      RenderJobRepository jobRepository,
                                      RenderJobLifecycleManager lifecycle,
                                      RenderBudgetService budgetService,
                                      RenderDispatcher dispatcher,
                                      MediaApiClient mediaApiClient,
                                      RenderEvents events) {
        this.preflight = preflight;
        this.jobRepository = jobRepository;
        this.lifecycle = lifecycle;
        this.budgetService = budgetService;
        this.dispatcher = dispatcher;
        this.mediaApiClient = mediaApiClient;
        this.events = events;
    }

    public RenderJobResponse startRender(Jwt jwt, UUID versionId, StartRenderRequest request) {
        UUID workspaceId = preflight.requireWorkspaceId(jwt);
        VideoProviderAdapter adapter = preflight.requireAdapter(request.provider());
        String aspectRatio = preflight.aspectRatioOrDefault(request.aspectRatio());
        String model = preflight.modelOrDefault(adapter, request.model());
        int duration = request.durationSeconds();

        RenderJobConfig config = RenderJobConfig.single(aspectRatio, duration, model);
        try {
            config.validate();
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }

        events.info("RENDER:REQUEST", "workspaceId={} versionId={} provider={} model={} durationSeconds={} aspectRatio={}",
                workspaceId, versionId, adapter.name(), model, duration, aspectRatio);

        BigDecimal estimate = adapter.estimateCost(duration, model);
        LedgerSubmission proposal = new LedgerSubmission(workspaceId, null, adapter.name(), null,
                duration, aspectRatio, request.prompt().length(), estimate);
        preflight.enforceBudget(proposal);
        boolean placeholder = preflight.requireCredentialOrPlaceholder(adapter, workspaceId);

        JobAdmission admission = lifecycle.openJob(new NewRenderJob(
                workspaceId, request.contentId(), versionId, adapter.name(), request.prompt(), config, estimate));
        RenderJobEntity job = admission.job();

        if (placeholder) {
            return toResponse(lifecycle.completeWithPlaceholder(job));
        }
        return toResponse(recordAndDispatch(job));
    }

    public RenderJobResponse retryJob(Jwt jwt, UUID jobId) {
        UUID workspaceId = preflight.requireWorkspaceId(jwt);
        return toResponse(retry(requireJob(jobId, workspaceId)));
    }

    /**
     * Retries the latest job of a version.
     */
    public RenderJobResponse retryVersion(Jwt jwt, UUID versionId) {
        UUID workspaceId = preflight.requireWorkspaceId(jwt);
        RenderJobEntity latest = jobRepository.findFirstByVersionIdAndWorkspaceIdOrderByCreatedAtDesc(versionId, workspaceId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No render job for version " + versionId));
        return toResponse(retry(latest));
    }

    public RenderJobResponse resetJob(Jwt jwt, UUID jobId, boolean force) {
        UUID workspaceId = preflight.requireWorkspaceId(jwt);
        return toResponse(lifecycle.reset(requireJob(jobId, workspaceId), force));
    }

    public RenderJobResponse getJob(Jwt jwt, UUID jobId) {
        UUID workspaceId = preflight.requireWorkspaceId(jwt);
        return toResponse(requireJob(jobId, workspaceId));
    }

    public EstimateResponse estimate(Jwt jwt, EstimateRequest request) {
        UUID workspaceId = preflight.requireWorkspaceId(jwt);
        VideoProviderAdapter adapter = preflight.requireAdapter(request.provider());
        String model = preflight.modelOrDefault(adapter, request.model());
        BigDecimal estimate = adapter.estimateCost(request.durationSeconds(), model);
        BudgetCheckResult budget = budgetService.checkBudget(workspaceId, estimate);
        return new EstimateResponse(
                adapter.name(),
                model,
                request.durationSeconds(),
                estimate,
                budget.allowed(),
                budget.reason(),
                budget.monthlySpent(),
                budget.monthlyLimit(),
                budget.dailyAttempts(),
                budget.dailyLimit()
        );
    }

    private RenderJobEntity retry(RenderJobEntity job) {
        if (job.getStatus() != RenderJobStatus.FAILED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Cannot retry: job is " + job.getStatus());
        }
        RenderJobConfig config = job.getConfig();
        int promptLength = job.getInputPrompt() == null ? 0 : job.getInputPrompt().length();
        preflight.enforceBudget(new LedgerSubmission(job.getWorkspaceId(), job.getJobId(), job.getProvider(), null,
                config.durationSeconds(), config.aspectRatio(), promptLength, job.getEstimatedCost()));
        RenderJobEntity queued = lifecycle.retry(job);
        return recordAndDispatch(queued);
    }

    private RenderJobEntity recordAndDispatch(RenderJobEntity job) {
        RenderJobConfig config = job.getConfig();
        int promptLength = job.getInputPrompt() == null ? 0 : job.getInputPrompt().length();
        Long ledgerEntryId = budgetService.recordSubmission(new LedgerSubmission(
                job.getWorkspaceId(), job.getJobId(), job.getProvider(), null,
                config.durationSeconds(), config.aspectRatio(), promptLength, job.getEstimatedCost()));
        RenderJobEntity tracked = lifecycle.attachLedgerEntry(job, ledgerEntryId);
        dispatcher.dispatch(tracked);
        return jobRepository.findById(tracked.getJobId()).orElse(tracked);
    }

    private RenderJobEntity requireJob(UUID jobId, UUID workspaceId) {
        return jobRepository.findByJobIdAndWorkspaceId(jobId, workspaceId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Render job not found"));
    }

    RenderJobResponse toResponse(RenderJobEntity job) {
        RenderErrorCode errorCode = job.getErrorCode();
        String errorMessage = job.getErrorMessage();
        String videoUrl = job.getOutputUrl();

        if (job.getStatus() == RenderJobStatus.COMPLETED) {
            if (job.getOutputMediaId() != null) {
                videoUrl = resolveMediaUrl(job.getOutputMediaId()).orElse(videoUrl);
            }
            boolean noStoryboard = job.getStoryboard() == null || job.getStoryboard().isEmpty();
            if ((videoUrl == null || videoUrl.isBlank()) && job.getOutputMediaId() == null && noStoryboard) {
                errorCode = RenderErrorCode.NO_OUTPUT;
                errorMessage = NO_OUTPUT_MESSAGE;
            }
        } else if (job.getStatus() == RenderJobStatus.FAILED && errorCode == null) {
            errorCode = RenderErrorCode.UNKNOWN_FAILURE;
            if (errorMessage == null) {
                errorMessage = UNKNOWN_FAILURE_MESSAGE;
            }
        }

        return new RenderJobResponse(
                job.getJobId(),
                job.getContentId(),
                job.getVersionId(),
                job.getSceneNumber(),
                job.getPreviousJobId(),
                job.getStatus(),
                job.getProgress(),
                job.getProgressMessage(),
                errorCode,
                errorMessage,
                job.getProvider(),
                job.getProviderJobId(),
                job.getEstimatedCost(),
                job.getActualCost(),
                job.getRetryCount(),
                videoUrl,
                job.getThumbnailUrl(),
                job.getOutputMediaId(),
                job.getStoryboard(),
                job.isPlaceholderOutput(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }

    private Optional<String> resolveMediaUrl(UUID mediaId) {
        try {
            return mediaApiClient.resolve(mediaId).map(MediaResolved::url);
        } catch (RestClientException ex) {
            events.warn("STORAGE:RESOLVE", "mediaId={} error={}", mediaId, RenderEvents.safeMessage(ex, 200));
            return Optional.empty();
        }
    }
}
