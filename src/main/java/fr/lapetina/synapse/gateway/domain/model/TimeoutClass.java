package fr.lapetina.synapse.gateway.domain.model;

import java.time.Duration;
import java.util.Locale;

/**
 * Named timeout policies, one per kind of backend call.
 * Durations are the built-in defaults; configuration may override them at startup.
 */
public enum TimeoutClass {
    LLM(Duration.ofSeconds(300)),
    EMBEDDINGS(Duration.ofSeconds(60)),
    TTS(Duration.ofSeconds(120)),
    STT(Duration.ofSeconds(600)),
    SPEAKER(Duration.ofSeconds(600)),
    AUDIO(Duration.ofSeconds(600)),
    DEFAULT(Duration.ofSeconds(60));

    private final Duration defaultDuration;

    TimeoutClass(Duration defaultDuration) {
        this.defaultDuration = defaultDuration;
    }

    public Duration getDefaultDuration() {
        return defaultDuration;
    }

    /**
     * Resolves a timeout class by name. Unknown or missing names fall back to {@link #DEFAULT}.
     */
    public static TimeoutClass fromName(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DEFAULT;
        }
    }
}
