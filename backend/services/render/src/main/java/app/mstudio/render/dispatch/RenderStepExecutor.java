package app.mstudio.render.dispatch;

import app.mstudio.render.budget.RenderBudgetService;
import app.mstudio.render.credential.CredentialResolver;
import app.mstudio.render.credential.ResolvedCredential;
import app.mstudio.render.domain.RenderJobConfig;
import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.domain.type.RenderErrorCode;
import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.job.RenderJobLifecycleManager;
import app.mstudio.render.job.RenderOutput;
import app.mstudio.render.job.RenderOutputStorage;
import app.mstudio.render.provider.ProviderException;
import app.mstudio.render.provider.ProviderNames;
import app.mstudio.render.provider.ProviderPollResult;
import app.mstudio.render.provider.ProviderSubmission;
import app.mstudio.render.provider.ProviderSubmitRequest;
import app.mstudio.render.provider.VideoProviderAdapter;
import app.mstudio.render.provider.VideoProviderRegistry;
import app.mstudio.render.repository.RenderJobRepository;
import app.mstudio.render.support.RenderEvents;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * The two steps of a render: hand the job to its provider, then poll the provider until the job finishes.
 * <p>
 * Both steps are safe to repeat. Submit does nothing once a provider job id is recorded, and neither step
 * touches a job that already finished. Transient provider errors are recorded on the job and reported as
 * retryable; every other failure fails the job.
 */
@Service
public class RenderStepExecutor {

    static final String NO_OUTPUT_MESSAGE = "Render completed but no output was stored.";

    private final RenderJobRepository jobRepository;
    private final RenderJobLifecycleManager lifecycle;
    private final VideoProviderRegistry providers;
    private final CredentialResolver credentials;
    private final RenderBudgetService budgetService;
    private final RenderOutputStorage outputStorage;
    private final RenderEvents events;

    public RenderStepExecutor(RenderJobRepository jobRepository,
                              RenderJobLifecycleManager lifecycle,
                              VideoProviderRegistry providers,
                              CredentialResolver credentials,
                              RenderBudgetService budgetService,
                              RenderOutputStorage outputStorage,
                              RenderEvents events) {
        this.jobRepository = jobRepository;
        this.lifecycle = lifecycle;
        this.providers = providers;
        this.credentials = credentials;
        this.budgetService = budgetService;
        this.outputStorage = outputStorage;
        this.events = events;
    }

    public StepOutcome submit(UUID jobId) {
        Optional<RenderJobEntity> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            return StepOutcome.missing(jobId);
        }
        RenderJobEntity job = found.get();
        if (job.getStatus().isTerminal()) {
            return StepOutcome.of(job, "already finished");
        }
        if (job.getProviderJobId() != null) {
            return StepOutcome.of(job, "already submitted");
        }

        Optional<VideoProviderAdapter> adapter = providers.find(job.getProvider());
        if (adapter.isEmpty()) {
            return StepOutcome.of(lifecycle.fail(job, RenderErrorCode.VALIDATION,
                    "Unknown video provider: " + job.getProvider()), "unknown provider");
        }
        Optional<String> apiKey = apiKeyFor(adapter.get(), job);
        if (apiKey.isEmpty()) {
            return StepOutcome.of(lifecycle.fail(job, RenderErrorCode.MISSING_API_KEY,
                    missingKeyMessage(job.getProvider())), "missing api key");
        }

        RenderJobConfig config = job.getConfig();
        ProviderSubmitRequest request = new ProviderSubmitRequest(
                job.getInputPrompt(),
                config.durationSeconds(),
                config.aspectRatio(),
                config.model(),
                apiKey.get()
        );

        ProviderSubmission submission;
        try {
            submission = adapter.get().submit(request);
        } catch (ProviderException ex) {
            return providerFailure(job, ex, "submit");
        } catch (RuntimeException ex) {
            events.error("JOB:SUBMIT", "jobId={} provider={} unexpected error={}",
                    jobId, job.getProvider(), RenderEvents.safeMessage(ex, 300));
            return StepOutcome.of(lifecycle.fail(job, RenderErrorCode.UNKNOWN_FAILURE,
                    RenderEvents.safeMessage(ex, 500)), "submit failed");
        }

        RenderJobEntity processing = lifecycle.markProcessing(job, submission.providerJobId(),
                submission.status() == null ? null : submission.status().name().toLowerCase(Locale.ROOT));
        budgetService.attachProviderJob(processing.getLedgerEntryId(), submission.providerJobId());
        events.info("JOB:SUBMIT", "jobId={} provider={} providerJobId={}",
                jobId, processing.getProvider(), submission.providerJobId());

        if (submission.completed()) {
            RenderOutput output = new RenderOutput(submission.outputUrl(), null, null, submission.storyboard());
            return completeOrFlag(processing, output);
        }
        return StepOutcome.of(processing, "submitted");
    }

    public StepOutcome poll(UUID jobId) {
        Optional<RenderJobEntity> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            return StepOutcome.missing(jobId);
        }
        RenderJobEntity job = found.get();
        if (job.getStatus().isTerminal()) {
            return StepOutcome.of(job, "already finished");
        }
        if (job.getProviderJobId() == null) {
            return StepOutcome.of(job, "not submitted");
        }
        if (lifecycle.isTimedOut(job)) {
            long minutes = lifecycle.renderTimeout().toMinutes();
            return StepOutcome.of(lifecycle.fail(job, RenderErrorCode.RENDER_TIMEOUT,
                    "Video rendering timed out after " + minutes + " minutes"), "timed out");
        }

        Optional<VideoProviderAdapter> adapterLookup = providers.find(job.getProvider());
        if (adapterLookup.isEmpty()) {
            return StepOutcome.of(lifecycle.fail(job, RenderErrorCode.VALIDATION,
                    "Unknown video provider: " + job.getProvider()), "unknown provider");
        }
        VideoProviderAdapter adapter = adapterLookup.get();
        Optional<String> apiKey = apiKeyFor(adapter, job);
        if (apiKey.isEmpty()) {
            return StepOutcome.of(lifecycle.fail(job, RenderErrorCode.MISSING_API_KEY,
                    missingKeyMessage(job.getProvider())), "missing api key");
        }

        ProviderPollResult result;
        try {
            result = adapter.poll(job.getProviderJobId(), apiKey.get());
        } catch (ProviderException ex) {
            return providerFailure(job, ex, "poll");
        }

        if (result.status() == RenderJobStatus.FAILED) {
            String message = result.errorMessage();
            RenderErrorCode code = message == null || message.isBlank()
                    ? RenderErrorCode.UNKNOWN_FAILURE
                    : RenderErrorCode.PROVIDER_FAILED;
            return StepOutcome.of(lifecycle.fail(job, code, message), "provider failed");
        }
        if (result.status() != RenderJobStatus.COMPLETED) {
            return StepOutcome.of(lifecycle.applyProgress(job, result), "in progress");
        }

        if (!result.requiresDownload()) {
            return completeOrFlag(job, new RenderOutput(result.outputUrl(), result.thumbnailUrl(), null, null));
        }

        byte[] video;
        try {
            video = adapter.download(job.getProviderJobId(), apiKey.get());
        } catch (ProviderException ex) {
            return providerFailure(job, ex, "download");
        }
        RenderOutput stored;
        try {
            stored = outputStorage.store(job, video);
        } catch (RuntimeException ex) {
            String message = "Failed to store render output: " + RenderEvents.safeMessage(ex, 300);
            events.warn("STORAGE:UPLOAD", "jobId={} error={}", jobId, message);
            return StepOutcome.retry(lifecycle.recordTransientError(job, RenderErrorCode.STORAGE_FAILED, message),
                    "storage failed");
        }
        return completeOrFlag(job, stored);
    }

    private StepOutcome completeOrFlag(RenderJobEntity job, RenderOutput output) {
        try {
            return StepOutcome.of(lifecycle.complete(job, output, null), "completed");
        } catch (IllegalStateException ex) {
            events.error("JOB:TRANSITION", "jobId={} completed without output", job.getJobId());
            return StepOutcome.of(lifecycle.fail(job, RenderErrorCode.NO_OUTPUT, NO_OUTPUT_MESSAGE), "no output");
        }
    }

    private StepOutcome providerFailure(RenderJobEntity job, ProviderException ex, String step) {
        String message = RenderEvents.safeMessage(ex, 500);
        if (ex.getKind().retryable()) {
            events.warn("JOB:" + step.toUpperCase(Locale.ROOT), "jobId={} provider={} retryable kind={} status={} error={}",
                    job.getJobId(), job.getProvider(), ex.getKind(), ex.getHttpStatus(), message);
            return StepOutcome.retry(lifecycle.recordTransientError(job, ex.getKind().errorCode(), message), step + " retry");
        }
        return StepOutcome.of(lifecycle.fail(job, ex.getKind().errorCode(), message), step + " failed");
    }

    private Optional<String> apiKeyFor(VideoProviderAdapter adapter, RenderJobEntity job) {
        if (!adapter.descriptor().requiresApiKey()) {
            return Optional.of("");
        }
        return credentials.resolve(job.getProvider(), job.getWorkspaceId()).map(ResolvedCredential::apiKey);
    }

    static String missingKeyMessage(String provider) {
        return "No API key configured for " + ProviderNames.normalize(provider)
                + ". Connect a workspace key or set " + ProviderNames.platformKeyVariable(provider) + ".";
    }
}
