package fr.lapetina.synapse.gateway.feed;

import fr.lapetina.synapse.gateway.domain.model.LogLevel;
import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Filter applied to backlog reads and live delivery: a minimum level and an
 * optional set of allowed sources (null or empty allows every source).
 */
public record FeedQuery(int limit, LogLevel minLevel, Set<String> sources) {

    public FeedQuery {
        minLevel = minLevel != null ? minLevel : LogLevel.INFO;
        sources = sources == null || sources.isEmpty() ? null : Set.copyOf(sources);
    }

    public boolean matches(TerminalEvent event) {
        if (!event.level().isAtLeast(minLevel)) {
            return false;
        }
        return sources == null || sources.contains(event.source());
    }

    /**
     * Parses a comma separated source list; blank input means no source filter.
     */
    public static Set<String> parseSources(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Set<String> values = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        return values.isEmpty() ? null : values;
    }
}
