package fr.lapetina.synapse.gateway.domain.model;

import java.util.Locale;

/**
 * Severity of a terminal feed line, ordered by rank for minimum-level filtering.
 */
public enum LogLevel {
    DEBUG(10),
    INFO(20),
    WARNING(30),
    ERROR(40),
    CRITICAL(50);

    private final int rank;

    LogLevel(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAtLeast(LogLevel minimum) {
        return rank >= minimum.rank;
    }

    /**
     * Parses a level name, accepting the common aliases WARN, FATAL and TRACE.
     * Unrecognized or missing names yield the fallback.
     */
    public static LogLevel parse(String name, LogLevel fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "WARN":
                return WARNING;
            case "FATAL":
                return CRITICAL;
            case "TRACE":
                return DEBUG;
            default:
                try {
                    return valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    return fallback;
                }
        }
    }
}
