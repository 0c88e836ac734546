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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RenderJobLifecycleManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-14T12:00:00Z");
    private static final String PLACEHOLDER = "https://example.test/placeholder.mp4";

    @Mock
    RenderJobRepository jobRepository;

    @Mock
    RenderBudgetService budgetService;

    RenderJobLifecycleManager manager;

    @BeforeEach
    void setup() {
        manager = newManager(false);
    }

    @Test
    void openJob_createsQueuedJobWhenSlotIsFree() {
        UUID versionId = UUID.randomUUID();
        when(jobRepository.findInSlot(eq(versionId), eq(0), any())).thenReturn(List.of());
        when(jobRepository.saveAndFlush(any(RenderJobEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        JobAdmission admission = manager.openJob(newJob(versionId));

        RenderJobEntity job = admission.job();
        assertThat(admission.replacedJobId()).isNull();
        assertThat(job.getStatus()).isEqualTo(RenderJobStatus.QUEUED);
        assertThat(job.getProgress()).isZero();
        assertThat(job.getQueuedAt()).isEqualTo(NOW);
        assertThat(job.getRetryCount()).isZero();
        assertThat(job.getPreviousJobId()).isNull();
    }

    @Test
    void openJob_rejectsWhileActiveJobIsFresh() {
        UUID versionId = UUID.randomUUID();
        RenderJobEntity active = job(RenderJobStatus.PROCESSING, NOW.minus(Duration.ofMinutes(2)));
        when(jobRepository.findInSlot(eq(versionId), eq(0), any())).thenReturn(List.of(active));

        assertThatThrownBy(() -> manager.openJob(newJob(versionId)))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
        verify(jobRepository, never()).saveAndFlush(any());
    }

    @Test
    void openJob_replacesStuckJobAndLinksIt() {
        UUID versionId = UUID.randomUUID();
        RenderJobEntity stuck = job(RenderJobStatus.PROCESSING, NOW.minus(Duration.ofMinutes(6)));
        stuck.setLedgerEntryId(40L);
        when(jobRepository.findInSlot(eq(versionId), eq(0), any())).thenReturn(List.of(stuck));
        when(jobRepository.save(any(RenderJobEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        when(jobRepository.saveAndFlush(any(RenderJobEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        JobAdmission admission = manager.openJob(newJob(versionId));

        assertThat(stuck.getStatus()).isEqualTo(RenderJobStatus.FAILED);
        assertThat(stuck.getErrorCode()).isEqualTo(RenderErrorCode.STUCK_RESET);
        assertThat(stuck.getErrorMessage()).contains("stuck");
        assertThat(admission.replacedJobId()).isEqualTo(stuck.getJobId());
        assertThat(admission.job().getStatus()).isEqualTo(RenderJobStatus.QUEUED);
        assertThat(admission.job().getPreviousJobId()).isEqualTo(stuck.getJobId());
        verify(budgetService).recordOutcome(eq(40L), eq(LedgerStatus.failed), any(), any());
    }

    @Test
    void openJob_rejectsInvalidConfig() {
        NewRenderJob request = new NewRenderJob(UUID.randomUUID(), null, UUID.randomUUID(), "runway", "prompt",
                RenderJobConfig.single("16:9", 0, null), BigDecimal.ONE);

        assertThatThrownBy(() -> manager.openJob(request))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("durationSeconds");
        verifyNoInteractions(jobRepository);
    }

    @Test
    void complete_passesQueuedJobThroughProcessing() {
        RenderJobEntity job = job(RenderJobStatus.QUEUED, NOW);
        job.setLedgerEntryId(5L);
        when(jobRepository.save(any(RenderJobEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        RenderJobEntity done = manager.complete(job,
                new RenderOutput(null, null, null, JsonNodeFactory.instance.arrayNode().add("frame")), null);

        assertThat(done.getStatus()).isEqualTo(RenderJobStatus.COMPLETED);
        assertThat(done.getProgress()).isEqualTo(100);
        assertThat(done.getStartedAt()).isEqualTo(NOW);
        assertThat(done.getActualCost()).isEqualByComparingTo(job.getEstimatedCost());
        verify(budgetService).recordOutcome(eq(5L), eq(LedgerStatus.completed), any(), isNull());
    }

    @Test
    void complete_withoutOutputIsRejected() {
        RenderJobEntity job = job(RenderJobStatus.PROCESSING, NOW);

        assertThatThrownBy(() -> manager.complete(job, new RenderOutput(" ", null, null, null), null))
                .isInstanceOf(IllegalStateException.class);
        assertThat(job.getStatus()).isEqualTo(RenderJobStatus.PROCESSING);
        verify(jobRepository, never()).save(any());
    }

    @Test
    void terminalJobsIgnoreLateResults() {
        RenderJobEntity job = job(RenderJobStatus.COMPLETED, NOW);

        manager.applyProgress(job, ProviderPollResult.processing("RUNNING", 40));
        manager.fail(job, RenderErrorCode.PROVIDER_FAILED, "late failure");

        assertThat(job.getStatus()).isEqualTo(RenderJobStatus.COMPLETED);
        verifyNoInteractions(jobRepository, budgetService);
    }

    @Test
    void applyProgress_neverMovesBackwardsAndCapsBelowHundred() {
        RenderJobEntity job = job(RenderJobStatus.PROCESSING, NOW);
        job.setProgress(60);
        when(jobRepository.save(any(RenderJobEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        manager.applyProgress(job, ProviderPollResult.processing("RUNNING", 30));
        assertThat(job.getProgress()).isEqualTo(60);

        manager.applyProgress(job, ProviderPollResult.processing("RUNNING", 100));
        assertThat(job.getProgress()).isEqualTo(99);
        assertThat(job.getProgressMessage()).isEqualTo("Rendering... 99%");
    }

    @Test
    void retry_isRejectedForActiveJobs() {
        RenderJobEntity job = job(RenderJobStatus.PROCESSING, NOW);

        assertThatThrownBy(() -> manager.retry(job))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("Cannot retry: job is PROCESSING");
    }

    @Test
    void retry_requeuesFailedJobAndClearsAttemptState() {
        RenderJobEntity job = job(RenderJobStatus.FAILED, NOW.minus(Duration.ofHours(1)));
        job.setErrorCode(RenderErrorCode.PROVIDER_AUTH);
        job.setErrorMessage("bad key");
        job.setProviderJobId("task-1");
        job.setLedgerEntryId(9L);
        when(jobRepository.findInSlot(eq(job.getVersionId()), anyInt(), any())).thenReturn(List.of());
        when(jobRepository.save(any(RenderJobEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        RenderJobEntity queued = manager.retry(job);

        assertThat(queued.getStatus()).isEqualTo(RenderJobStatus.QUEUED);
        assertThat(queued.getRetryCount()).isEqualTo(1);
        assertThat(queued.getQueuedAt()).isEqualTo(NOW);
        assertThat(queued.getErrorCode()).isNull();
        assertThat(queued.getProviderJobId()).isNull();
        assertThat(queued.getLedgerEntryId()).isNull();
    }

    @Test
    void reset_reportsWaitTimeForFreshJob() {
        RenderJobEntity job = job(RenderJobStatus.PROCESSING, NOW.minus(Duration.ofMinutes(1)));

        assertThatThrownBy(() -> manager.reset(job, false))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("Wait 240s");
    }

    @Test
    void reset_forceFailsProcessingJobImmediately() {
        RenderJobEntity job = job(RenderJobStatus.PROCESSING, NOW.minus(Duration.ofMinutes(1)));
        when(jobRepository.save(any(RenderJobEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        RenderJobEntity reset = manager.reset(job, true);

        assertThat(reset.getStatus()).isEqualTo(RenderJobStatus.FAILED);
        assertThat(reset.getErrorCode()).isEqualTo(RenderErrorCode.STUCK_RESET);
    }

    @Test
    void reset_forceIsRejectedForQueuedJob() {
        RenderJobEntity job = job(RenderJobStatus.QUEUED, NOW);

        assertThatThrownBy(() -> manager.reset(job, true))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("PROCESSING or FAILED");
    }

    @Test
    void reset_rejectsCompletedJob() {
        RenderJobEntity job = job(RenderJobStatus.COMPLETED, NOW);

        assertThatThrownBy(() -> manager.reset(job, true))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("completed");
    }

    @Test
    void completeWithPlaceholder_requiresDevFallback() {
        RenderJobEntity job = job(RenderJobStatus.QUEUED, NOW);

        assertThatThrownBy(() -> manager.completeWithPlaceholder(job))
                .isInstanceOf(IllegalStateException.class);
        assertThat(job.getStatus()).isEqualTo(RenderJobStatus.QUEUED);
    }

    @Test
    void completeWithPlaceholder_marksOutputAsPlaceholder() {
        RenderJobLifecycleManager devManager = newManager(true);
        RenderJobEntity job = job(RenderJobStatus.QUEUED, NOW);
        when(jobRepository.save(any(RenderJobEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        RenderJobEntity done = devManager.completeWithPlaceholder(job);

        assertThat(done.getStatus()).isEqualTo(RenderJobStatus.COMPLETED);
        assertThat(done.isPlaceholderOutput()).isTrue();
        assertThat(done.getOutputUrl()).isEqualTo(PLACEHOLDER);
        assertThat(done.getProviderJobId()).isEqualTo("mock-" + job.getJobId());
        assertThat(done.getActualCost()).isEqualByComparingTo("0");
    }

    @Test
    void isTimedOut_measuresFromStart() {
        RenderJobEntity job = job(RenderJobStatus.PROCESSING, NOW.minus(Duration.ofMinutes(12)));
        job.setStartedAt(NOW.minus(Duration.ofMinutes(11)));

        assertThat(manager.isTimedOut(job)).isTrue();

        job.setStartedAt(NOW.minus(Duration.ofMinutes(9)));
        assertThat(manager.isTimedOut(job)).isFalse();
    }

    private RenderJobLifecycleManager newManager(boolean devFallback) {
        return new RenderJobLifecycleManager(
                jobRepository,
                budgetService,
                new RenderJobProps(Duration.ofMinutes(5), Duration.ofMinutes(10), 20, 4),
                new DevFallbackProps(devFallback, PLACEHOLDER),
                new RenderEvents(new SimpleMeterRegistry()),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private static NewRenderJob newJob(UUID versionId) {
        return new NewRenderJob(UUID.randomUUID(), UUID.randomUUID(), versionId, "runway", "A calm lake at dawn",
                RenderJobConfig.single("16:9", 8, "veo3.1"), new BigDecimal("2.72"));
    }

    static RenderJobEntity job(RenderJobStatus status, Instant queuedAt) {
        RenderJobEntity job = new RenderJobEntity();
        job.setJobId(UUID.randomUUID());
        job.setWorkspaceId(UUID.randomUUID());
        job.setVersionId(UUID.randomUUID());
        job.setStatus(status);
        job.setProgress(0);
        job.setProvider("runway");
        job.setConfig(RenderJobConfig.single("16:9", 8, "veo3.1"));
        job.setInputPrompt("A calm lake at dawn");
        job.setEstimatedCost(new BigDecimal("2.72"));
        job.setRetryCount(0);
        job.setQueuedAt(queuedAt);
        job.setCreatedAt(queuedAt);
        job.setUpdatedAt(queuedAt);
        return job;
    }
}
