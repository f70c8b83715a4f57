package fr.lapetina.synapse.gateway.feed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Scrubs credentials from log lines before they reach the feed.
 *
 * Built-in rules cover authorization headers, bare bearer tokens and
 * {@code api_key / token / secret / password / passwd / cookie} assignments.
 * Operators may add patterns separated by {@code ||}; every match of those is
 * replaced with {@code [REDACTED]}. A pattern that does not compile is skipped.
 */
public final class LogRedactor {

    private static final Logger log = LoggerFactory.getLogger(LogRedactor.class);

    static final String REDACTED = "[REDACTED]";

    private static final List<Rule> BUILT_IN = List.of(
            new Rule(Pattern.compile("(?i)\\b(authorization)\\s*:\\s*bearer\\s+[a-z0-9._\\-+/=]+"),
                    "$1: Bearer " + REDACTED),
            new Rule(Pattern.compile("(?i)\\bbearer\\s+[a-z0-9._\\-+/=]+"),
                    "Bearer " + REDACTED),
            new Rule(Pattern.compile("(?i)(\"?(?:api[-_]?key|token|secret|password|passwd|cookie)\"?\\s*[:=]\\s*)(\".*?\"|[^,\\s;]+)"),
                    "$1" + REDACTED)
    );

    private final List<Pattern> extraPatterns;

    public LogRedactor(String extraPatterns) {
        this.extraPatterns = compileExtra(extraPatterns);
    }

    public LogRedactor() {
        this("");
    }

    public String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = text;
        for (Rule rule : BUILT_IN) {
            out = rule.pattern().matcher(out).replaceAll(rule.replacement());
        }
        for (Pattern pattern : extraPatterns) {
            out = pattern.matcher(out).replaceAll(REDACTED);
        }
        return out;
    }

    int extraPatternCount() {
        return extraPatterns.size();
    }

    private static List<Pattern> compileExtra(String raw) {
        List<Pattern> patterns = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return patterns;
        }
        for (String candidate : raw.split("\\|\\|")) {
            String pattern = candidate.trim();
            if (pattern.isEmpty()) {
                continue;
            }
            try {
                patterns.add(Pattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid redaction pattern: pattern={}, error={}", pattern, e.getDescription());
            }
        }
        return List.copyOf(patterns);
    }

    private record Rule(Pattern pattern, String replacement) {
    }
}
