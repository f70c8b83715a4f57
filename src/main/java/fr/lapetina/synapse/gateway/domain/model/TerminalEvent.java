package fr.lapetina.synapse.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One sanitized line of the operator terminal feed.
 * The message is already redacted, newline-escaped and truncated when an instance is built.
 */
public record TerminalEvent(
        @JsonProperty("ts") String ts,
        @JsonProperty("source") String source,
        @JsonProperty("level") LogLevel level,
        @JsonProperty("message") String message,
        @JsonProperty("instance") String instance
) {
    public TerminalEvent {
        Objects.requireNonNull(ts, "Timestamp is required");
        Objects.requireNonNull(level, "Level is required");
        source = source != null ? source : "";
        message = message != null ? message : "";
        instance = instance != null ? instance : "";
    }
}
