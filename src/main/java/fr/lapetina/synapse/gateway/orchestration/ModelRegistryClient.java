package fr.lapetina.synapse.gateway.orchestration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.model.ModelLoadState;
import fr.lapetina.synapse.gateway.domain.model.ModelStatus;
import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Talks to the LLM router's model registry: list models, load one, unload one.
 *
 * The router answers {@code GET /models} with
 * {@code {"data": [{"id": "...", "status": {"value": "loaded", "failed": false, "args": [...]}}]}}
 * Older routers put the list under {@code models} or return it as the bare root array.
 * It accepts {@code POST /models/load} and {@code POST /models/unload} with {@code {"model": id}}.
 */
public class ModelRegistryClient {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistryClient.class);

    private static final Map<String, String> JSON_HEADERS = Map.of("Content-Type", "application/json");

    private final BackendClient client;
    private final ObjectMapper objectMapper;

    public ModelRegistryClient(BackendClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    /**
     * Fetches every model entry the router knows about, split parts included.
     *
     * @throws ModelLoadException with {@code REGISTRY_UNAVAILABLE} if the router answers
     *                            with an error status or an unreadable body
     */
    public List<ModelLoadState> listModels(Backend backend) {
        BackendResponse response = client.request(backend.name(), "GET", backend.resolve("/models"),
                TimeoutClass.DEFAULT, null, Map.of("Accept", "application/json"));

        if (!response.isSuccess()) {
            throw new ModelLoadException(ModelLoadException.Reason.REGISTRY_UNAVAILABLE, null,
                    "Model registry answered HTTP " + response.statusCode(), response.statusCode());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new ModelLoadException(ModelLoadException.Reason.REGISTRY_UNAVAILABLE, null,
                    "Model registry returned invalid JSON: " + e.getMessage());
        }

        JsonNode entries = root.isArray() ? root
                : root.has("data") ? root.get("data") : root.path("models");
        List<ModelLoadState> states = new ArrayList<>();
        if (entries.isArray()) {
            for (JsonNode entry : entries) {
                String id = entry.hasNonNull("id") ? entry.get("id").asText() : entry.path("name").asText(null);
                if (id == null || id.isBlank()) {
                    continue;
                }
                states.add(toState(id, entry.path("status")));
            }
        }
        log.debug("Model registry listed: backend={}, entries={}", backend.name(), states.size());
        return states;
    }

    /**
     * Collapsed view of the registry, one entry per logical model.
     */
    public List<ModelView> listLogicalModels(Backend backend) {
        return SplitModelCollapser.collapse(listModels(backend));
    }

    public BackendResponse load(Backend backend, String modelId) {
        log.info("Requesting model load: backend={}, model={}", backend.name(), modelId);
        return command(backend, "/models/load", modelId);
    }

    public BackendResponse unload(Backend backend, String modelId) {
        log.info("Requesting model unload: backend={}, model={}", backend.name(), modelId);
        return command(backend, "/models/unload", modelId);
    }

    private BackendResponse command(Backend backend, String path, String modelId) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsString(Map.of("model", modelId)).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize model command", e);
        }
        return client.request(backend.name(), "POST", backend.resolve(path), TimeoutClass.DEFAULT, body, JSON_HEADERS);
    }

    private static ModelLoadState toState(String id, JsonNode status) {
        if (status.isTextual()) {
            return new ModelLoadState(id, ModelStatus.fromValue(status.asText()), false, List.of());
        }
        List<String> args = new ArrayList<>();
        JsonNode rawArgs = status.path("args");
        if (rawArgs.isArray()) {
            rawArgs.forEach(arg -> args.add(arg.asText()));
        }
        return new ModelLoadState(
                id,
                ModelStatus.fromValue(status.path("value").asText(null)),
                status.path("failed").asBoolean(false),
                args);
    }
}
