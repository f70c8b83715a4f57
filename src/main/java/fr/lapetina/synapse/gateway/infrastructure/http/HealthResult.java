package fr.lapetina.synapse.gateway.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.synapse.gateway.domain.model.HealthStatus;

/**
 * Outcome of one health probe. {@code code} is set when the backend answered,
 * {@code error} when it could not be reached.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResult(
        @JsonProperty("status") HealthStatus status,
        @JsonProperty("code") Integer code,
        @JsonProperty("error") String error
) {
    public static HealthResult healthy(int code) {
        return new HealthResult(HealthStatus.HEALTHY, code, null);
    }

    public static HealthResult unhealthy(int code) {
        return new HealthResult(HealthStatus.UNHEALTHY, code, null);
    }

    public static HealthResult unreachable(String error) {
        return new HealthResult(HealthStatus.UNREACHABLE, null, error != null ? error : "unreachable");
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
