package fr.lapetina.synapse.gateway.domain.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Description of one editable profile setting, as served by the schema endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProfileField(
        @JsonProperty("name") String name,
        @JsonProperty("label") String label,
        @JsonProperty("type") FieldType type,
        @JsonProperty("min") Number min,
        @JsonProperty("max") Number max,
        @JsonProperty("step") Number step,
        @JsonProperty("default") Object defaultValue,
        @JsonProperty("choices") List<String> choices,
        @JsonProperty("description") String description,
        @JsonProperty("applies_at") String appliesAt
) {
    static final String GENERATION = "generation";
    static final String REQUEST = "request";

    static ProfileField text(String name, String label, String description) {
        return new ProfileField(name, label, FieldType.STRING, null, null, null, null, null, description, REQUEST);
    }

    static ProfileField number(String name, String label, double min, double max, double step,
                               Double defaultValue, String description) {
        return new ProfileField(name, label, FieldType.NUMBER, min, max, step, defaultValue, null, description, GENERATION);
    }

    static ProfileField integer(String name, String label, long min, long max,
                                Long defaultValue, String description) {
        return new ProfileField(name, label, FieldType.INTEGER, min, max, 1, defaultValue, null, description, GENERATION);
    }

    static ProfileField choice(String name, String label, List<String> choices,
                               String defaultValue, String description, String appliesAt) {
        return new ProfileField(name, label, FieldType.ENUM, null, null, null, defaultValue,
                List.copyOf(choices), description, appliesAt);
    }
}
