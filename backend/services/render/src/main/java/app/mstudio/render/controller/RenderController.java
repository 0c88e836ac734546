package app.mstudio.render.controller;

import app.mstudio.render.controller.dto.EstimateRequest;
import app.mstudio.render.controller.dto.EstimateResponse;
import app.mstudio.render.controller.dto.RenderJobResponse;
import app.mstudio.render.controller.dto.ResetJobRequest;
import app.mstudio.render.controller.dto.StartRenderRequest;
import app.mstudio.render.service.RenderOrchestrationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
public class RenderController {

    private final RenderOrchestrationService orchestrationService;

    public RenderController(RenderOrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    @PostMapping("/versions/{versionId}/render")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public RenderJobResponse render(@AuthenticationPrincipal Jwt jwt,
                                    @PathVariable UUID versionId,
                                    @Valid @RequestBody StartRenderRequest request) {
        return orchestrationService.startRender(jwt, versionId, request);
    }

    @PostMapping("/versions/{versionId}/retry")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public RenderJobResponse retryVersion(@AuthenticationPrincipal Jwt jwt,
                                          @PathVariable UUID versionId) {
        return orchestrationService.retryVersion(jwt, versionId);
    }

    @GetMapping("/render-jobs/{jobId}")
    public RenderJobResponse getJob(@AuthenticationPrincipal Jwt jwt,
                                    @PathVariable UUID jobId) {
        return orchestrationService.getJob(jwt, jobId);
    }

    @PostMapping("/render-jobs/{jobId}/retry")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public RenderJobResponse retryJob(@AuthenticationPrincipal Jwt jwt,
                                      @PathVariable UUID jobId) {
        return orchestrationService.retryJob(jwt, jobId);
    }

    @PostMapping("/render-jobs/{jobId}/reset")
    public RenderJobResponse reset(@AuthenticationPrincipal Jwt jwt,
                                   @PathVariable UUID jobId,
                                   @RequestBody(required = false) ResetJobRequest request) {
        boolean force = request != null && request.force();
        return orchestrationService.resetJob(jwt, jobId, force);
    }

    @PostMapping("/render/estimate")
    public EstimateResponse estimate(@AuthenticationPrincipal Jwt jwt,
                                     @Valid @RequestBody EstimateRequest request) {
        return orchestrationService.estimate(jwt, request);
    }
}
