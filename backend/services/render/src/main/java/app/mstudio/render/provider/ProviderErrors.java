package app.mstudio.render.provider;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Supplier;

public final class ProviderErrors {

    private static final int MAX_BODY_CHARS = 200;

    private ProviderErrors() {
    }

    /**
     * Runs a provider HTTP call, translating transport and status failures into {@link ProviderException}.
     */
    public static <T> T call(String provider, String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientException ex) {
            throw translate(provider, operation, ex);
        }
    }

    public static ProviderException translate(String provider, String operation, RestClientException ex) {
        if (ex instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            String message = provider + " " + operation + " error (" + status + "): " + summarize(response);
            return new ProviderException(provider, ProviderErrorKind.fromHttpStatus(status), status, message, ex);
        }
        String reason = ex instanceof ResourceAccessException ? "unreachable" : "failed";
        return new ProviderException(provider, ProviderErrorKind.UPSTREAM, null,
                provider + " " + operation + " " + reason + ": " + ex.getClass().getSimpleName(), ex);
    }

    public static ProviderException emptyResponse(String provider, String operation) {
        return new ProviderException(provider, ProviderErrorKind.UPSTREAM, provider + " " + operation + " response is empty");
    }

    private static String summarize(RestClientResponseException ex) {
        String body = ex.getResponseBodyAsString();
        if (body.isBlank()) {
            body = ex.getStatusText();
        }
        body = body.replaceAll("\\s+", " ").trim();
        return body.length() > MAX_BODY_CHARS ? body.substring(0, MAX_BODY_CHARS) : body;
    }
}
