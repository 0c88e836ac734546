package app.mstudio.render.provider;

import app.mstudio.render.domain.type.RenderErrorCode;

public enum ProviderErrorKind {
    AUTH(RenderErrorCode.PROVIDER_AUTH, false),
    PAYLOAD(RenderErrorCode.PROVIDER_PAYLOAD, false),
    RATE_LIMITED(RenderErrorCode.PROVIDER_RATE_LIMITED, true),
    UPSTREAM(RenderErrorCode.PROVIDER_UPSTREAM, true);

    private final RenderErrorCode errorCode;
    private final boolean retryable;

    ProviderErrorKind(RenderErrorCode errorCode, boolean retryable) {
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public RenderErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Whether the execution substrate should retry the step instead of failing the job.
     */
    public boolean retryable() {
        return retryable;
    }

    public static ProviderErrorKind fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTH;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status >= 500) {
            return UPSTREAM;
        }
        return PAYLOAD;
    }
}
