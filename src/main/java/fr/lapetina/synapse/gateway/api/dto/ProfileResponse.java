package fr.lapetina.synapse.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.synapse.gateway.domain.profile.ModelFamily;

import java.util.Map;

/**
 * Stored profile as returned to clients.
 */
public record ProfileResponse(
        @JsonProperty("model_id") String modelId,
        @JsonProperty("family") ModelFamily family,
        @JsonProperty("values") Map<String, Object> values,
        @JsonInclude(JsonInclude.Include.ALWAYS)
        @JsonProperty("updated_at") String updatedAt
) {
}
