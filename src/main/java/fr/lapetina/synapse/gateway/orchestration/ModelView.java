package fr.lapetina.synapse.gateway.orchestration;

import fr.lapetina.synapse.gateway.domain.model.ModelStatus;

import java.util.List;
import java.util.Map;

/**
 * One logical model as presented to callers. A split model shows up once, under the
 * id of its lowest-numbered part, with {@code parts} set to the number of parts.
 *
 * @param id        logical id
 * @param status    most permissive status across the parts
 * @param failed    true if any part reported a failed load
 * @param args      launch arguments of the representative part
 * @param parts     number of parts, 1 for a regular model
 * @param memberIds ids of every part as reported by the router
 */
public record ModelView(
        String id,
        ModelStatus status,
        boolean failed,
        List<String> args,
        int parts,
        List<String> memberIds
) {
    public ModelView {
        args = args != null ? List.copyOf(args) : List.of();
        memberIds = memberIds != null ? List.copyOf(memberIds) : List.of(id);
    }

    /**
     * Settings the model was launched with, keyed by hint name.
     */
    public Map<String, Integer> runtimeHints() {
        return RuntimeHints.parse(args);
    }

    public boolean contains(String modelId) {
        return memberIds.contains(modelId);
    }
}
