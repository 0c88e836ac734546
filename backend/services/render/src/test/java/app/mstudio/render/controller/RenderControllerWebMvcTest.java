package app.mstudio.render.controller;

import app.mstudio.render.config.SecurityConfig;
import app.mstudio.render.controller.dto.RenderJobResponse;
import app.mstudio.render.controller.dto.StartRenderRequest;
import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.service.RenderOrchestrationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RenderController.class)
@Import(SecurityConfig.class)
@ActiveProfiles("test")
class RenderControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    RenderOrchestrationService orchestrationService;

    private final UUID workspaceId = UUID.randomUUID();

    @Test
    void render_acceptsRequestAndReturnsQueuedJob() throws Exception {
        UUID versionId = UUID.randomUUID();
        UUID jobId = UUID.randomUUID();
        when(orchestrationService.startRender(any(Jwt.class), eq(versionId), any(StartRenderRequest.class)))
                .thenReturn(queued(jobId, versionId));

        mockMvc.perform(post("/versions/{versionId}/render", versionId)
                        .with(jwt().jwt(j -> j.claim("workspace_id", workspaceId.toString())))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"provider":"runway","prompt":"A product reveal","durationSeconds":8}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value(jobId.toString()))
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andExpect(jsonPath("$.estimatedCost").value(2.72));
    }

    @Test
    void render_blankPromptIsRejectedBeforeOrchestration() throws Exception {
        mockMvc.perform(post("/versions/{versionId}/render", UUID.randomUUID())
                        .with(jwt().jwt(j -> j.claim("workspace_id", workspaceId.toString())))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"provider":"runway","prompt":" ","durationSeconds":8}
                                """))
                .andExpect(status().isBadRequest());

        verify(orchestrationService, never()).startRender(any(), any(), any());
    }

    @Test
    void render_budgetRejectionSurfacesAs429() throws Exception {
        when(orchestrationService.startRender(any(Jwt.class), any(UUID.class), any(StartRenderRequest.class)))
                .thenThrow(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Monthly video budget exceeded"));

        mockMvc.perform(post("/versions/{versionId}/render", UUID.randomUUID())
                        .with(jwt().jwt(j -> j.claim("workspace_id", workspaceId.toString())))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"provider":"runway","prompt":"A product reveal","durationSeconds":8}
                                """))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void reset_withoutBodyIsNotForced() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(orchestrationService.resetJob(any(Jwt.class), eq(jobId), eq(false)))
                .thenReturn(queued(jobId, UUID.randomUUID()));

        mockMvc.perform(post("/render-jobs/{jobId}/reset", jobId)
                        .with(jwt().jwt(j -> j.claim("workspace_id", workspaceId.toString()))))
                .andExpect(status().isOk());

        verify(orchestrationService).resetJob(any(Jwt.class), eq(jobId), eq(false));
    }

    @Test
    void getJob_requiresAuthentication() throws Exception {
        mockMvc.perform(get("/render-jobs/{jobId}", UUID.randomUUID()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void internalSteps_refuseUserTokens() throws Exception {
        mockMvc.perform(post("/internal/render-jobs/{jobId}/poll", UUID.randomUUID())
                        .with(jwt().jwt(j -> j.claim("workspace_id", workspaceId.toString()))))
                .andExpect(status().isForbidden());
    }

    private static RenderJobResponse queued(UUID jobId, UUID versionId) {
        return new RenderJobResponse(jobId, null, versionId, null, null, RenderJobStatus.QUEUED, 0,
                "Queued", null, null, "runway", null, new BigDecimal("2.72"), null, 0,
                null, null, null, null, false, Instant.parse("2026-03-14T12:00:00Z"), null, null);
    }
}
