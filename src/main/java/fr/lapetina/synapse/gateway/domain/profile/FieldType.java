package fr.lapetina.synapse.gateway.domain.profile;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Value type of a profile field.
 */
public enum FieldType {
    STRING,
    NUMBER,
    INTEGER,
    ENUM;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
