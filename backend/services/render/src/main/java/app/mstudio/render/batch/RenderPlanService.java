package app.mstudio.render.batch;

import app.mstudio.render.budget.LedgerSubmission;
import app.mstudio.render.budget.RenderBudgetService;
import app.mstudio.render.config.BatchProps;
import app.mstudio.render.controller.dto.PlanScene;
import app.mstudio.render.controller.dto.PlanSceneResult;
import app.mstudio.render.controller.dto.RenderPlanRequest;
import app.mstudio.render.controller.dto.RenderPlanResponse;
import app.mstudio.render.dispatch.DispatchOutcome;
import app.mstudio.render.dispatch.RenderDispatcher;
import app.mstudio.render.domain.RenderJobConfig;
import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.job.NewRenderJob;
import app.mstudio.render.job.RenderJobLifecycleManager;
import app.mstudio.render.provider.VideoProviderAdapter;
import app.mstudio.render.repository.RenderJobRepository;
import app.mstudio.render.service.RenderPreflight;
import app.mstudio.render.support.RenderEvents;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Renders a multi-scene plan. The whole plan is checked against the budget once, then every scene gets its
 * own job in the version's scene slot and is dispatched through the concurrency gate.
 * <p>
 * A scene that cannot start is reported in the result; the other scenes still go out.
 */
@Service
public class RenderPlanService {

    private final RenderPreflight preflight;
    private final RenderJobRepository jobRepository;
    private final RenderJobLifecycleManager lifecycle;
    private final RenderBudgetService budgetService;
    private final RenderDispatcher dispatcher;
    private final ConcurrencyGate gate;
    private final BatchProps batchProps;
    private final RenderEvents events;

    public RenderPlanService(RenderPreflight preflight,
                             RenderJobRepository jobRepository,
                             RenderJobLifecycleManager lifecycle,
                             RenderBudgetService budgetService,
                             RenderDispatcher dispatcher,
                             ConcurrencyGate gate,
                             BatchProps batchProps,
                             RenderEvents events) {
        this.preflight = preflight;
        this.jobRepository = jobRepository;
        this.lifecycle = lifecycle;
        this.budgetService = budgetService;
        this.dispatcher = dispatcher;
        this.gate = gate;
        this.batchProps = batchProps;
        this.events = events;
    }

    public RenderPlanResponse renderPlan(Jwt jwt, RenderPlanRequest request) {
        UUID workspaceId = preflight.requireWorkspaceId(jwt);
        VideoProviderAdapter adapter = preflight.requireAdapter(request.provider());
        String aspectRatio = preflight.aspectRatioOrDefault(request.aspectRatio());
        String model = preflight.modelOrDefault(adapter, request.model());
        int totalScenes = request.scenes().size();

        List<SceneTask> tasks = new ArrayList<>(totalScenes);
        BigDecimal total = BigDecimal.ZERO;
        int totalDuration = 0;
        int totalPromptLength = 0;
        for (int i = 0; i < totalScenes; i++) {
            PlanScene scene = request.scenes().get(i);
            BigDecimal estimate = adapter.estimateCost(scene.durationSeconds(), model);
            RenderJobConfig config = new RenderJobConfig(i + 1, totalScenes, scene.label(), aspectRatio,
                    scene.durationSeconds(), model);
            tasks.add(new SceneTask(scene, config, estimate));
            total = total.add(estimate);
            totalDuration += scene.durationSeconds();
            totalPromptLength += scene.prompt().length();
        }

        events.info("RENDER:REQUEST", "workspaceId={} versionId={} provider={} model={} scenes={} estimate={}",
                workspaceId, request.versionId(), adapter.name(), model, totalScenes, total);
        preflight.enforceBudget(new LedgerSubmission(workspaceId, null, adapter.name(), null,
                totalDuration, aspectRatio, totalPromptLength, total));
        boolean placeholder = preflight.requireCredentialOrPlaceholder(adapter, workspaceId);

        List<PlanSceneResult> results = gate.runInWindows(tasks, batchProps.windowSize(),
                task -> renderScene(workspaceId, request, adapter, task, placeholder));
        return new RenderPlanResponse(request.versionId(), total, results);
    }

    private PlanSceneResult renderScene(UUID workspaceId,
                                        RenderPlanRequest request,
                                        VideoProviderAdapter adapter,
                                        SceneTask task,
                                        boolean placeholder) {
        int sceneNumber = task.config().sceneNumber();
        try {
            RenderJobEntity job = lifecycle.openJob(new NewRenderJob(workspaceId, request.contentId(), request.versionId(),
                    adapter.name(), task.scene().prompt(), task.config(), task.estimate())).job();
            if (placeholder) {
                RenderJobEntity done = lifecycle.completeWithPlaceholder(job);
                return new PlanSceneResult(sceneNumber, done.getJobId(), done.getStatus(), task.estimate(), true, null);
            }
            Long ledgerEntryId = budgetService.recordSubmission(new LedgerSubmission(workspaceId, job.getJobId(),
                    adapter.name(), null, task.config().durationSeconds(), task.config().aspectRatio(),
                    task.scene().prompt().length(), task.estimate()));
            RenderJobEntity tracked = lifecycle.attachLedgerEntry(job, ledgerEntryId);
            DispatchOutcome outcome = dispatcher.dispatch(tracked);
            RenderJobEntity current = jobRepository.findById(job.getJobId()).orElse(tracked);
            RenderJobStatus status = outcome.status() != null ? outcome.status() : current.getStatus();
            boolean dispatched = outcome.accepted() && status != RenderJobStatus.FAILED;
            events.info("PLAN:SCENE", "versionId={} scene={}/{} jobId={} mode={} accepted={} status={}",
                    request.versionId(), sceneNumber, task.config().totalScenes(), job.getJobId(),
                    outcome.mode(), dispatched, status);
            return new PlanSceneResult(sceneNumber, job.getJobId(), status, task.estimate(),
                    dispatched, dispatched ? null : failureReason(current, outcome));
        } catch (ResponseStatusException ex) {
            events.warn("PLAN:SCENE", "versionId={} scene={} rejected status={} reason={}",
                    request.versionId(), sceneNumber, ex.getStatusCode().value(), ex.getReason());
            return new PlanSceneResult(sceneNumber, null, null, task.estimate(), false, ex.getReason());
        } catch (RuntimeException ex) {
            events.error("PLAN:SCENE", "versionId={} scene={} error={}",
                    request.versionId(), sceneNumber, RenderEvents.safeMessage(ex, 300));
            return new PlanSceneResult(sceneNumber, null, null, task.estimate(), false, RenderEvents.safeMessage(ex, 300));
        }
    }

    private static String failureReason(RenderJobEntity job, DispatchOutcome outcome) {
        if (job.getErrorMessage() != null && !job.getErrorMessage().isBlank()) {
            return job.getErrorMessage();
        }
        return outcome.detail() != null ? outcome.detail() : "Render job could not be dispatched";
    }

    private record SceneTask(PlanScene scene, RenderJobConfig config, BigDecimal estimate) {
    }
}
