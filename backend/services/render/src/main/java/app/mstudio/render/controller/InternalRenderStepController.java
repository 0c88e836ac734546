package app.mstudio.render.controller;

import app.mstudio.render.controller.dto.StepResponse;
import app.mstudio.render.dispatch.RenderStepExecutor;
import app.mstudio.render.dispatch.StepOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Step callbacks for the execution substrate. A 503 tells the substrate to retry the step later.
 */
@RestController
@RequestMapping("/internal/render-jobs/{jobId}")
public class InternalRenderStepController {

    private final RenderStepExecutor stepExecutor;

    public InternalRenderStepController(RenderStepExecutor stepExecutor) {
        this.stepExecutor = stepExecutor;
    }

    @PostMapping("/submit")
    public ResponseEntity<StepResponse> submit(@PathVariable UUID jobId) {
        return toResponse(stepExecutor.submit(jobId));
    }

    @PostMapping("/poll")
    public ResponseEntity<StepResponse> poll(@PathVariable UUID jobId) {
        return toResponse(stepExecutor.poll(jobId));
    }

    private ResponseEntity<StepResponse> toResponse(StepOutcome outcome) {
        StepResponse body = new StepResponse(outcome.jobId(), outcome.status(), outcome.finished(),
                outcome.retryable(), outcome.detail());
        if (outcome.status() == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        if (outcome.retryable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return ResponseEntity.ok(body);
    }
}
