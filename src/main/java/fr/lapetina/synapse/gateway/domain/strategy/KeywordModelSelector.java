package fr.lapetina.synapse.gateway.domain.strategy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Routes auto-model chat requests to a coder or a general model.
 *
 * The latest user message is matched against programming signals. A code fence, an
 * unambiguous term (stack trace, a language name, {@code =>}) or an error type name selects
 * the coder model on its own; words that also belong to everyday prose (class, loop, api)
 * need a second, different one. Anything else goes to the general model.
 */
public final class KeywordModelSelector implements ModelSelectionStrategy {

    public static final Set<String> DEFAULT_AUTO_ALIASES = Set.of("auto", "default");

    private static final Pattern CODE_FENCE = Pattern.compile("```");

    // One match is enough: these rarely show up outside programming talk
    private static final Pattern STRONG_SIGNALS = Pattern.compile(
            "\\b(?:stack\\s*trace|traceback|segfault|refactor(?:ing)?|debug(?:ging|ger)?|compiler|"
                    + "compile\\s+error|syntax\\s+error|regexp?|sql|python|javascript|typescript|kotlin|golang|"
                    + "pytest|junit|npm|maven|gradle|kubernetes|dockerfile|unit\\s*tests?|"
                    + "console\\.log|public\\s+static|printf)\\b"
                    + "|\\bdef\\s+\\w+\\s*\\(|\\bfrom\\s+[\\w.]+\\s+import\\b"
                    + "|(?<!\\w)(?:c\\+\\+|c#)(?!\\w)|=>",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ERROR_TYPE = Pattern.compile("\\b[A-Z][a-z]+(?:[A-Z][a-z]*)*(?:Exception|Error)\\b");

    // Everyday words as well; two different ones are needed
    private static final Pattern WEAK_SIGNALS = Pattern.compile(
            "\\b(?:code|coding|program(?:ming)?|function|method|class|bug|api|endpoint|json|yaml|"
                    + "java|rust|php|ruby|bash|shell|script|git|docker|variable|loop|array|recursion|"
                    + "algorithm|syntax|linter?|exception|compile[d]?)\\b"
                    + "|::|\\b\\w+\\(\\)",
            Pattern.CASE_INSENSITIVE);

    private static final int WEAK_SIGNALS_REQUIRED = 2;

    private final String generalModel;
    private final String coderModel;
    private final Set<String> autoAliases;

    public KeywordModelSelector(String generalModel, String coderModel, Set<String> autoAliases) {
        this.generalModel = generalModel;
        this.coderModel = coderModel;
        Set<String> aliases = autoAliases == null || autoAliases.isEmpty() ? DEFAULT_AUTO_ALIASES : autoAliases;
        this.autoAliases = aliases.stream()
                .map(alias -> alias.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public KeywordModelSelector(String generalModel, String coderModel) {
        this(generalModel, coderModel, DEFAULT_AUTO_ALIASES);
    }

    @Override
    public String getName() {
        return "keyword";
    }

    @Override
    public ModelSelection select(JsonNode payload) {
        String requested = payload != null && payload.hasNonNull("model") ? payload.get("model").asText() : null;
        if (!isAutoAlias(requested)) {
            return ModelSelection.explicit(requested);
        }
        String text = latestUserText(payload);
        if (looksLikeProgramming(text)) {
            return new ModelSelection(coderModel, true, ModelSelection.CODER);
        }
        return new ModelSelection(generalModel, true, ModelSelection.GENERAL);
    }

    public boolean isAutoAlias(String model) {
        return model == null || model.isBlank() || autoAliases.contains(model.trim().toLowerCase(Locale.ROOT));
    }

    static boolean looksLikeProgramming(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (CODE_FENCE.matcher(text).find() || STRONG_SIGNALS.matcher(text).find()
                || ERROR_TYPE.matcher(text).find()) {
            return true;
        }
        Set<String> weak = new HashSet<>();
        Matcher matcher = WEAK_SIGNALS.matcher(text);
        while (matcher.find()) {
            String signal = matcher.group().toLowerCase(Locale.ROOT);
            weak.add(signal.endsWith("()") ? "()" : signal);
            if (weak.size() >= WEAK_SIGNALS_REQUIRED) {
                return true;
            }
        }
        return false;
    }

    /**
     * Text of the last message with role {@code user}: string content, or the
     * concatenated {@code text} parts of array content.
     */
    static String latestUserText(JsonNode payload) {
        if (payload == null) {
            return "";
        }
        JsonNode messages = payload.path("messages");
        if (!messages.isArray()) {
            return "";
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            JsonNode message = messages.get(i);
            if (!"user".equals(message.path("role").asText())) {
                continue;
            }
            JsonNode content = message.path("content");
            if (content.isTextual()) {
                return content.asText();
            }
            if (content.isArray()) {
                StringBuilder text = new StringBuilder();
                for (JsonNode part : content) {
                    if (part.isTextual()) {
                        text.append(part.asText()).append('\n');
                    } else if (part.path("text").isTextual()) {
                        text.append(part.get("text").asText()).append('\n');
                    }
                }
                return text.toString();
            }
            return "";
        }
        return "";
    }
}
