package fr.lapetina.synapse.gateway.orchestration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.synapse.gateway.domain.strategy.ModelSelection;

/**
 * Chat completion payload ready to be forwarded: model chosen, model loaded, profile merged.
 */
public record PreparedChat(ObjectNode payload, ModelSelection selection, boolean profileApplied) {

    public String model() {
        return selection.model();
    }

    public boolean isStream() {
        return payload.path("stream").asBoolean(false);
    }
}
