package fr.lapetina.synapse.gateway.infrastructure.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.synapse.gateway.infrastructure.http.HealthResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated health: {@code healthy} only when every backend probe answered 200.
 */
public record GatewayHealth(
        @JsonProperty("status") String status,
        @JsonProperty("backends") Map<String, HealthResult> backends
) {
    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    public static GatewayHealth of(Map<String, HealthResult> results) {
        boolean allHealthy = results.values().stream().allMatch(HealthResult::isHealthy);
        return new GatewayHealth(allHealthy ? HEALTHY : DEGRADED,
                Collections.unmodifiableMap(new LinkedHashMap<>(results)));
    }
}
