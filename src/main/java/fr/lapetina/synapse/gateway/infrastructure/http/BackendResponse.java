package fr.lapetina.synapse.gateway.infrastructure.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fully buffered backend answer. Any HTTP status, including 4xx and 5xx, ends up here.
 */
public record BackendResponse(
        int statusCode,
        Map<String, List<String>> headers,
        byte[] body
) {
    public BackendResponse {
        headers = headers != null ? headers : Map.of();
        body = body != null ? body : new byte[0];
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Optional<String> header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return Optional.of(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    public String contentType() {
        return header("Content-Type").orElse("application/octet-stream");
    }

    public boolean isJson() {
        return contentType().toLowerCase(Locale.ROOT).contains("json");
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
