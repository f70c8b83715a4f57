package fr.lapetina.synapse.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Result of POST /models/{id}/profile/apply.
 */
public record ProfileApplyResponse(
        @JsonProperty("model_id") String modelId,
        @JsonProperty("values") Map<String, Object> values,
        @JsonProperty("load") LoadResult load
) {

    /**
     * Outcome of the optional load; status and error are omitted when not relevant.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LoadResult(
            @JsonProperty("requested") boolean requested,
            @JsonProperty("success") boolean success,
            @JsonProperty("status_code") Integer statusCode,
            @JsonProperty("error") String error
    ) {
        public static LoadResult notRequested() {
            return new LoadResult(false, false, null, null);
        }
    }
}
