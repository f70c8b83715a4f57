package fr.lapetina.synapse.gateway.infrastructure.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored profile of one model: its values and when they last changed.
 */
public record ProfileRecord(
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("values") Map<String, Object> values
) {
    public ProfileRecord {
        values = values != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(values))
                : Map.of();
    }
}
