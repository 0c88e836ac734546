package app.mstudio.render.provider;

public class ProviderException extends RuntimeException {

    private final String provider;
    private final ProviderErrorKind kind;
    private final Integer httpStatus;

    public ProviderException(String provider, ProviderErrorKind kind, Integer httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public ProviderException(String provider, ProviderErrorKind kind, String message) {
        this(provider, kind, null, message, null);
    }

    public String getProvider() {
        return provider;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
