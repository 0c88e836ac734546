package app.mstudio.render.domain.type;

/**
 * Error codes stored on a render job and surfaced to clients.
 */
public enum RenderErrorCode {
    MISSING_API_KEY,
    BUDGET_EXCEEDED,
    VALIDATION,
    PROVIDER_AUTH,
    PROVIDER_PAYLOAD,
    PROVIDER_RATE_LIMITED,
    PROVIDER_UPSTREAM,
    PROVIDER_FAILED,
    STORAGE_FAILED,
    RENDER_TIMEOUT,
    NO_OUTPUT,
    STUCK_RESET,
    DISPATCH_FAILED,
    UNKNOWN_FAILURE
}
