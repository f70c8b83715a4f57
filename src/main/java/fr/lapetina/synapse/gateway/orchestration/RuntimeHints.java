package fr.lapetina.synapse.gateway.orchestration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime settings read back from the launch arguments the router reports for a model,
 * such as the context size. They describe how the model was started and are not editable
 * through profiles.
 */
public final class RuntimeHints {

    public static final String CTX_SIZE = "runtime_ctx_size";

    private static final Map<String, String> FLAGS = Map.of(CTX_SIZE, "--ctx-size");

    private RuntimeHints() {
    }

    /**
     * Picks the known flags out of an argv-style list. A flag without a following
     * integer value is skipped.
     */
    public static Map<String, Integer> parse(List<String> args) {
        if (args == null || args.isEmpty()) {
            return Map.of();
        }
        Map<String, Integer> hints = new LinkedHashMap<>();
        FLAGS.forEach((hint, flag) -> {
            int index = args.indexOf(flag);
            if (index < 0 || index + 1 >= args.size()) {
                return;
            }
            try {
                hints.put(hint, Integer.parseInt(args.get(index + 1).trim()));
            } catch (NumberFormatException ignored) {
                // not a number: the hint stays absent
            }
        });
        return Collections.unmodifiableMap(hints);
    }
}
