package app.mstudio.render.service;

import app.mstudio.render.budget.BudgetCheckResult;
import app.mstudio.render.budget.LedgerSubmission;
import app.mstudio.render.budget.RenderBudgetService;
import app.mstudio.render.config.DevFallbackProps;
import app.mstudio.render.credential.CredentialResolver;
import app.mstudio.render.provider.ProviderNames;
import app.mstudio.render.provider.VideoProviderAdapter;
import app.mstudio.render.provider.VideoProviderRegistry;
import app.mstudio.render.security.CurrentWorkspaceProvider;
import app.mstudio.render.support.RenderEvents;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * Checks shared by single renders and render plans, run before any job row exists.
 */
@Component
public class RenderPreflight {

    static final String DEFAULT_ASPECT_RATIO = "16:9";

    private final CurrentWorkspaceProvider currentWorkspaceProvider;
    private final VideoProviderRegistry providers;
    private final RenderBudgetService budgetService;
    private final CredentialResolver credentials;
    private final DevFallbackProps devFallbackProps;
    private final RenderEvents events;

    public RenderPreflight(CurrentWorkspaceProvider currentWorkspaceProvider,
                           VideoProviderRegistry providers,
                           RenderBudgetService budgetService,
                           CredentialResolver credentials,
                           DevFallbackProps devFallbackProps,
                           RenderEvents events) {
        this.currentWorkspaceProvider = currentWorkspaceProvider;
        this.providers = providers;
        this.budgetService = budgetService;
        this.credentials = credentials;
        this.devFallbackProps = devFallbackProps;
        this.events = events;
    }

    public UUID requireWorkspaceId(Jwt jwt) {
        try {
            return currentWorkspaceProvider.requireWorkspaceId(jwt);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, ex.getMessage());
        }
    }

    public VideoProviderAdapter requireAdapter(String provider) {
        return providers.find(provider)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown video provider: " + provider));
    }

    public String aspectRatioOrDefault(String aspectRatio) {
        return aspectRatio == null || aspectRatio.isBlank() ? DEFAULT_ASPECT_RATIO : aspectRatio.trim();
    }

    public String modelOrDefault(VideoProviderAdapter adapter, String model) {
        return model == null || model.isBlank() ? adapter.descriptor().defaultModel() : model.trim();
    }

    /**
     * Rejects the proposal with 429 when it does not fit the workspace budget. The rejection is kept in the
     * ledger as a blocked entry.
     */
    public BudgetCheckResult enforceBudget(LedgerSubmission proposal) {
        BudgetCheckResult result = budgetService.checkBudget(proposal.workspaceId(), proposal.estimatedCostUsd());
        if (!result.allowed()) {
            budgetService.recordBlocked(proposal, result.reason());
            throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, result.reason());
        }
        return result;
    }

    /**
     * @return {@code true} when no key exists and the dev fallback should synthesize a placeholder output
     */
    public boolean requireCredentialOrPlaceholder(VideoProviderAdapter adapter, UUID workspaceId) {
        if (!adapter.descriptor().requiresApiKey()) {
            return false;
        }
        if (credentials.resolve(adapter.name(), workspaceId).isPresent()) {
            return false;
        }
        if (devFallbackProps.enabled()) {
            events.warn("KEYS", "provider={} workspaceId={} dev fallback active, placeholder output", adapter.name(), workspaceId);
            return true;
        }
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "No API key configured for " + adapter.name() + ". Connect a workspace key or set "
                        + ProviderNames.platformKeyVariable(adapter.name()) + ".");
    }
}
