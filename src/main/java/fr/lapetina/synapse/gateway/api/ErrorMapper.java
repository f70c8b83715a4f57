package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import fr.lapetina.synapse.gateway.domain.profile.RequestValidationException;
import fr.lapetina.synapse.gateway.infrastructure.health.UnknownBackendException;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendException;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendResponse;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendTimeoutException;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendUnavailableException;
import fr.lapetina.synapse.gateway.infrastructure.profile.ProfileStoreException;
import fr.lapetina.synapse.gateway.orchestration.ModelLoadException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Translates exceptions and upstream failures into an HTTP status and a JSON envelope.
 */
public final class ErrorMapper {

    static final int MAX_DETAIL_CHARS = 1000;

    private ErrorMapper() {
    }

    public record ApiError(int status, Map<String, Object> body, boolean unexpected) {
    }

    public static ApiError map(Throwable error) {
        if (error instanceof UnknownBackendException) {
            return error(503, "Backend unavailable", error.getMessage());
        }
        if (error instanceof BackendUnavailableException) {
            return error(503, "Backend unavailable", error.getMessage());
        }
        if (error instanceof BackendTimeoutException) {
            return error(504, "Backend timeout", null);
        }
        if (error instanceof BackendException) {
            return error(502, "Backend error", error.getMessage());
        }
        if (error instanceof ModelLoadException) {
            ModelLoadException e = (ModelLoadException) error;
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("reason", e.getReason().name().toLowerCase(Locale.ROOT));
            body.put("model", e.getModelId());
            if (e.getUpstreamStatus() != null) {
                body.put("upstream_status", e.getUpstreamStatus());
            }
            return new ApiError(e.getReason().getHttpStatus(), body, false);
        }
        if (error instanceof RequestValidationException) {
            return error(400, error.getMessage(), null);
        }
        if (error instanceof JsonProcessingException) {
            return error(400, "Invalid JSON body", ((JsonProcessingException) error).getOriginalMessage());
        }
        if (error instanceof ProfileStoreException) {
            // The message names the profile file; it is logged by the handler, never returned
            return error(500, "Profile store error", null);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Internal server error");
        return new ApiError(500, body, true);
    }

    /**
     * Envelope for a non-JSON upstream error body.
     */
    public static Map<String, Object> upstreamError(String label, BackendResponse response) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", label);
        body.put("detail", truncate(response.bodyAsString()));
        return body;
    }

    static String truncate(String detail) {
        if (detail == null) {
            return "";
        }
        return detail.length() > MAX_DETAIL_CHARS ? detail.substring(0, MAX_DETAIL_CHARS) : detail;
    }

    private static ApiError error(int status, String message, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (detail != null) {
            body.put("detail", detail);
        }
        return new ApiError(status, body, false);
    }
}
