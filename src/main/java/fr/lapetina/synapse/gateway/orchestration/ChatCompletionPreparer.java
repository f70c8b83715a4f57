package fr.lapetina.synapse.gateway.orchestration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.profile.ProfileDefaults;
import fr.lapetina.synapse.gateway.domain.profile.ProfileSchema;
import fr.lapetina.synapse.gateway.domain.profile.RequestValidationException;
import fr.lapetina.synapse.gateway.domain.strategy.ModelSelection;
import fr.lapetina.synapse.gateway.domain.strategy.ModelSelectionStrategy;
import fr.lapetina.synapse.gateway.infrastructure.profile.ModelProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns an inbound chat completion payload into the one sent to the router:
 * resolves the model, makes sure it is loaded, then fills gaps from its stored profile.
 */
public class ChatCompletionPreparer {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionPreparer.class);

    private final ModelSelectionStrategy selector;
    private final ModelLoadOrchestrator orchestrator;
    private final ModelProfileStore profileStore;

    public ChatCompletionPreparer(
            ModelSelectionStrategy selector,
            ModelLoadOrchestrator orchestrator,
            ModelProfileStore profileStore
    ) {
        this.selector = selector;
        this.orchestrator = orchestrator;
        this.profileStore = profileStore;
    }

    /**
     * Prepares the payload in place.
     *
     * @throws RequestValidationException if no model can be determined
     * @throws ModelLoadException         if the model cannot be brought up
     */
    public PreparedChat prepare(Backend router, ObjectNode payload) {
        ModelSelection selection = selector.select(payload);
        if (selection.model() == null || selection.model().isBlank()) {
            throw new RequestValidationException("No model requested and no default model configured");
        }
        if (selection.automatic()) {
            log.info("Model selected automatically: model={}, category={}", selection.model(), selection.category());
        }
        payload.put("model", selection.model());

        orchestrator.ensureModelLoaded(router, selection.model());

        Map<String, Object> profile = profileFor(selection.model());
        boolean applied = ProfileDefaults.apply(payload, profile);
        if (applied) {
            log.debug("Profile defaults applied: model={}, keys={}", selection.model(), profile.keySet());
        }
        return new PreparedChat(payload, selection, applied);
    }

    /**
     * Stored values restricted to the fields of the model's family.
     */
    Map<String, Object> profileFor(String modelId) {
        ProfileSchema schema = ProfileSchema.forModel(modelId);
        Map<String, Object> filtered = new LinkedHashMap<>();
        profileStore.getProfile(modelId).forEach((key, value) -> {
            if (schema.field(key).isPresent()) {
                filtered.put(key, value);
            }
        });
        return filtered;
    }
}
