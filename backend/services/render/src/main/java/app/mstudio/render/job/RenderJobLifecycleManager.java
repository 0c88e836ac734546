package app.mstudio.render.job;

import app.mstudio.render.budget.RenderBudgetService;
import app.mstudio.render.config.DevFallbackProps;
import app.mstudio.render.config.RenderJobProps;
import app.mstudio.render.domain.RenderJobConfig;
import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.domain.type.LedgerStatus;
import app.mstudio.render.domain.type.RenderErrorCode;
import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.provider.ProviderPollResult;
import app.mstudio.render.repository.RenderJobRepository;
import app.mstudio.render.support.RenderEvents;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Owns every status change of a render job.
 * <p>
 * A job moves QUEUED to PROCESSING when the provider accepts it, then to COMPLETED or FAILED. FAILED may go
 * back to QUEUED through {@link #retry}. A job that stays QUEUED or PROCESSING longer than the stuck threshold
 * is failed the next time its version is rendered and a new job takes its slot; the remote task is left alone.
 */
@Service
public class RenderJobLifecycleManager {

    static final Set<RenderJobStatus> ACTIVE = EnumSet.of(RenderJobStatus.QUEUED, RenderJobStatus.PROCESSING);
    private static final int ERROR_MESSAGE_MAX = 500;

    private final RenderJobRepository jobRepository;
    private final RenderBudgetService budgetService;
    private final RenderJobProps jobProps;
    private final DevFallbackProps devFallbackProps;
    private final RenderEvents events;
    private final Clock clock;

    public RenderJobLifecycleManager(RenderJobRepository jobRepository,
                                     RenderBudgetService budgetService,
                                     RenderJobProps jobProps,
                                     DevFallbackProps devFallbackProps,
                                     RenderEvents events,
                                     Clock clock) {
        this.jobRepository = jobRepository;
        this.budgetService = budgetService;
        this.jobProps = jobProps;
        this.devFallbackProps = devFallbackProps;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Creates a QUEUED job. When the version slot already holds an active job, that job must be stuck; it is
     * failed and the new job records it as its predecessor. Otherwise the request conflicts.
     */
    @Transactional
    public JobAdmission openJob(NewRenderJob request) {
        RenderJobConfig config = request.config();
        try {
            config.validate();
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }

        UUID replaced = null;
        if (request.versionId() != null) {
            int slot = config.sceneNumber() == null ? 0 : config.sceneNumber();
            List<RenderJobEntity> active = jobRepository.findInSlot(request.versionId(), slot, ACTIVE);
            for (RenderJobEntity existing : active) {
                if (!isStuck(existing)) {
                    throw new ResponseStatusException(HttpStatus.CONFLICT,
                            "Render already in progress for version " + request.versionId() + " (job " + existing.getJobId() + ")");
                }
                failStuck(existing);
                replaced = existing.getJobId();
            }
        }

        Instant now = Instant.now(clock);
        RenderJobEntity job = new RenderJobEntity();
        job.setJobId(UUID.randomUUID());
        job.setWorkspaceId(request.workspaceId());
        job.setContentId(request.contentId());
        job.setVersionId(request.versionId());
        job.setSceneNumber(config.sceneNumber());
        job.setPreviousJobId(replaced);
        job.setStatus(RenderJobStatus.QUEUED);
        job.setProgress(0);
        job.setProgressMessage("Waiting in queue...");
        job.setProvider(request.provider());
        job.setConfig(config);
        job.setInputPrompt(request.prompt());
        job.setEstimatedCost(request.estimatedCost());
        job.setRetryCount(0);
        job.setPlaceholderOutput(false);
        job.setQueuedAt(now);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);

        try {
            RenderJobEntity saved = jobRepository.saveAndFlush(job);
            events.info("JOB:TRANSITION", "jobId={} versionId={} status=QUEUED provider={} replaced={}",
                    saved.getJobId(), saved.getVersionId(), saved.getProvider(), replaced);
            return new JobAdmission(saved, replaced);
        } catch (DataIntegrityViolationException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Render already in progress for version " + request.versionId());
        }
    }

    @Transactional
    public RenderJobEntity attachLedgerEntry(RenderJobEntity job, Long ledgerEntryId) {
        job.setLedgerEntryId(ledgerEntryId);
        job.setUpdatedAt(Instant.now(clock));
        return jobRepository.save(job);
    }

    /**
     * The provider accepted the job.
     */
    @Transactional
    public RenderJobEntity markProcessing(RenderJobEntity job, String providerJobId, String providerStatus) {
        transition(job, RenderJobStatus.PROCESSING);
        Instant now = Instant.now(clock);
        job.setProviderJobId(providerJobId);
        job.setProviderStatus(providerStatus);
        job.setStartedAt(now);
        job.setErrorCode(null);
        job.setErrorMessage(null);
        job.setProgressMessage("Rendering...");
        job.setUpdatedAt(now);
        return jobRepository.save(job);
    }

    /**
     * Applies a normalized poll result. Results for jobs that already finished are ignored.
     */
    @Transactional
    public RenderJobEntity applyProgress(RenderJobEntity job, ProviderPollResult result) {
        if (job.getStatus().isTerminal()) {
            return job;
        }
        if (job.getStatus() == RenderJobStatus.QUEUED && result.status() == RenderJobStatus.PROCESSING) {
            transition(job, RenderJobStatus.PROCESSING);
            job.setStartedAt(Instant.now(clock));
        }
        int progress = result.progress() == null ? job.getProgress() : Math.max(job.getProgress(), Math.min(result.progress(), 99));
        job.setProgress(progress);
        job.setProviderStatus(result.providerStatus());
        job.setProgressMessage(result.status() == RenderJobStatus.QUEUED ? "Waiting in queue..." : "Rendering... " + progress + "%");
        job.setErrorCode(null);
        job.setErrorMessage(null);
        job.setUpdatedAt(Instant.now(clock));
        return jobRepository.save(job);
    }

    /**
     * Completes a processing job. A QUEUED job from a synchronous provider passes through PROCESSING first.
     *
     * @throws IllegalStateException when the output carries no asset
     */
    @Transactional
    public RenderJobEntity complete(RenderJobEntity job, RenderOutput output, BigDecimal actualCost) {
        if (job.getStatus().isTerminal()) {
            return job;
        }
        if (output == null || output.isEmpty()) {
            throw new IllegalStateException("Render job " + job.getJobId() + " has no output asset");
        }
        Instant now = Instant.now(clock);
        if (job.getStatus() == RenderJobStatus.QUEUED) {
            transition(job, RenderJobStatus.PROCESSING);
            job.setStartedAt(now);
        }
        transition(job, RenderJobStatus.COMPLETED);
        job.setProgress(100);
        job.setProgressMessage("Completed");
        job.setOutputUrl(output.outputUrl());
        job.setThumbnailUrl(output.thumbnailUrl());
        job.setOutputMediaId(output.mediaId());
        job.setStoryboard(output.storyboard());
        job.setActualCost(actualCost != null ? actualCost : job.getEstimatedCost());
        job.setErrorCode(null);
        job.setErrorMessage(null);
        job.setCompletedAt(now);
        job.setUpdatedAt(now);
        RenderJobEntity saved = jobRepository.save(job);
        budgetService.recordOutcome(job.getLedgerEntryId(), LedgerStatus.completed, saved.getActualCost(), null);
        events.info("JOB:TRANSITION", "jobId={} status=COMPLETED provider={}", job.getJobId(), job.getProvider());
        return saved;
    }

    @Transactional
    public RenderJobEntity fail(RenderJobEntity job, RenderErrorCode errorCode, String message) {
        if (job.getStatus().isTerminal()) {
            return job;
        }
        transition(job, RenderJobStatus.FAILED);
        Instant now = Instant.now(clock);
        String safeMessage = message == null || message.isBlank() ? null : RenderEvents.truncate(message, ERROR_MESSAGE_MAX);
        job.setErrorCode(errorCode);
        job.setErrorMessage(safeMessage);
        job.setProgressMessage("Failed");
        job.setCompletedAt(now);
        job.setUpdatedAt(now);
        RenderJobEntity saved = jobRepository.save(job);
        budgetService.recordOutcome(job.getLedgerEntryId(), LedgerStatus.failed, null, safeMessage);
        events.warn("JOB:TRANSITION", "jobId={} status=FAILED errorCode={} message={}", job.getJobId(), errorCode, safeMessage);
        return saved;
    }

    /**
     * Records a retryable provider error without changing the status.
     */
    @Transactional
    public RenderJobEntity recordTransientError(RenderJobEntity job, RenderErrorCode errorCode, String message) {
        if (job.getStatus().isTerminal()) {
            return job;
        }
        job.setErrorCode(errorCode);
        job.setErrorMessage(RenderEvents.truncate(message, ERROR_MESSAGE_MAX));
        job.setUpdatedAt(Instant.now(clock));
        return jobRepository.save(job);
    }

    /**
     * Requeues a failed job for another attempt. The stuck clock restarts.
     */
    @Transactional
    public RenderJobEntity retry(RenderJobEntity job) {
        if (job.getStatus() != RenderJobStatus.FAILED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Cannot retry: job is " + job.getStatus());
        }
        if (job.getVersionId() != null) {
            int slot = job.getSceneNumber() == null ? 0 : job.getSceneNumber();
            List<RenderJobEntity> active = jobRepository.findInSlot(job.getVersionId(), slot, ACTIVE);
            if (!active.isEmpty()) {
                throw new ResponseStatusException(HttpStatus.CONFLICT,
                        "Another render is active for this version (job " + active.get(0).getJobId() + ")");
            }
        }
        transition(job, RenderJobStatus.QUEUED);
        Instant now = Instant.now(clock);
        job.setRetryCount(job.getRetryCount() + 1);
        job.setProgress(0);
        job.setProgressMessage("Waiting in queue...");
        job.setErrorCode(null);
        job.setErrorMessage(null);
        job.setProviderJobId(null);
        job.setProviderStatus(null);
        job.setLedgerEntryId(null);
        job.setOutputUrl(null);
        job.setThumbnailUrl(null);
        job.setOutputMediaId(null);
        job.setStoryboard(null);
        job.setActualCost(null);
        job.setStartedAt(null);
        job.setCompletedAt(null);
        job.setQueuedAt(now);
        job.setUpdatedAt(now);
        RenderJobEntity saved = jobRepository.save(job);
        events.info("JOB:TRANSITION", "jobId={} status=QUEUED retryCount={}", job.getJobId(), job.getRetryCount());
        return saved;
    }

    /**
     * Fails a job that is stuck, or with {@code force} any processing job. Failed jobs are returned unchanged.
     */
    @Transactional
    public RenderJobEntity reset(RenderJobEntity job, boolean force) {
        RenderJobStatus status = job.getStatus();
        if (status == RenderJobStatus.FAILED) {
            return job;
        }
        if (status == RenderJobStatus.COMPLETED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Cannot reset a completed job");
        }
        if (force) {
            if (status != RenderJobStatus.PROCESSING) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "Force reset only applies to PROCESSING or FAILED jobs");
            }
            events.warn("JOB:RESET", "jobId={} forced=true age={}s", job.getJobId(), age(job).toSeconds());
            return fail(job, RenderErrorCode.STUCK_RESET, "Job reset by request");
        }
        if (!isStuck(job)) {
            long waitSeconds = jobProps.stuckThreshold().minus(age(job)).toSeconds();
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Job is still within its render window. Wait " + Math.max(waitSeconds, 1) + "s or retry with force");
        }
        return failStuck(job);
    }

    /**
     * Completes a job with the configured placeholder video. Only valid when the dev fallback is enabled and
     * the caller found no provider credential.
     */
    @Transactional
    public RenderJobEntity completeWithPlaceholder(RenderJobEntity job) {
        if (!devFallbackProps.enabled() || devFallbackProps.placeholderUrl() == null) {
            throw new IllegalStateException("Placeholder output is disabled");
        }
        markProcessing(job, "mock-" + job.getJobId(), "placeholder");
        job.setPlaceholderOutput(true);
        events.warn("JOB:TRANSITION", "jobId={} placeholder output, no provider credential", job.getJobId());
        return complete(job, new RenderOutput(devFallbackProps.placeholderUrl(), null, null, null), BigDecimal.ZERO);
    }

    public boolean isStuck(RenderJobEntity job) {
        return job.getStatus().isActive() && age(job).compareTo(jobProps.stuckThreshold()) > 0;
    }

    public boolean isTimedOut(RenderJobEntity job) {
        if (job.getStatus() != RenderJobStatus.PROCESSING || job.getStartedAt() == null) {
            return false;
        }
        return Duration.between(job.getStartedAt(), Instant.now(clock)).compareTo(jobProps.renderTimeout()) > 0;
    }

    public Duration renderTimeout() {
        return jobProps.renderTimeout();
    }

    private RenderJobEntity failStuck(RenderJobEntity job) {
        long minutes = Math.max(jobProps.stuckThreshold().toMinutes(), 1);
        events.warn("JOB:RESET", "jobId={} status={} age={}s", job.getJobId(), job.getStatus(), age(job).toSeconds());
        return fail(job, RenderErrorCode.STUCK_RESET, "Job reset: stuck for over " + minutes + " minutes");
    }

    private Duration age(RenderJobEntity job) {
        Instant since = job.getQueuedAt() != null ? job.getQueuedAt() : job.getCreatedAt();
        return Duration.between(since, Instant.now(clock));
    }

    private static void transition(RenderJobEntity job, RenderJobStatus target) {
        RenderJobTransitions.require(job.getStatus(), target);
        job.setStatus(target);
    }
}
