package app.mstudio.render.controller;

import app.mstudio.render.batch.RenderPlanService;
import app.mstudio.render.controller.dto.RenderPlanRequest;
import app.mstudio.render.controller.dto.RenderPlanResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/render-plans")
public class RenderPlanController {

    private final RenderPlanService planService;

    public RenderPlanController(RenderPlanService planService) {
        this.planService = planService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public RenderPlanResponse render(@AuthenticationPrincipal Jwt jwt,
                                     @Valid @RequestBody RenderPlanRequest request) {
        return planService.renderPlan(jwt, request);
    }
}
