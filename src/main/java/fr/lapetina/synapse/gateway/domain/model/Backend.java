package fr.lapetina.synapse.gateway.domain.model;

import java.util.Objects;

/**
 * One downstream inference service: its registry name, base url and health probe path.
 */
public record Backend(String name, String baseUrl, String healthPath) {

    public Backend {
        Objects.requireNonNull(name, "Backend name is required");
        Objects.requireNonNull(baseUrl, "Backend url is required");
        baseUrl = stripTrailingSlash(baseUrl.trim());
        healthPath = healthPath == null || healthPath.isBlank() ? "/health" : healthPath.trim();
    }

    /**
     * Appends a path to the base url, inserting the separating slash when missing.
     */
    public String resolve(String path) {
        if (path == null || path.isEmpty()) {
            return baseUrl;
        }
        return path.startsWith("/") ? baseUrl + path : baseUrl + "/" + path;
    }

    public String healthUrl() {
        return resolve(healthPath);
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
