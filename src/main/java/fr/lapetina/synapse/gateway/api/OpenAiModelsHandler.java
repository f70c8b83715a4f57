package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.infrastructure.health.BackendRegistry;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendResponse;
import fr.lapetina.synapse.gateway.orchestration.ModelRegistryClient;
import fr.lapetina.synapse.gateway.orchestration.ModelView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * GET /v1/models: OpenAI-style list merged from the LLM router and the embeddings backend.
 * Each source is best-effort; an unreachable one is logged and left out.
 */
final class OpenAiModelsHandler extends GatewayHandler {

    private static final Logger log = LoggerFactory.getLogger(OpenAiModelsHandler.class);

    static final String PATH = "/v1/models";

    private final BackendRegistry registry;
    private final BackendClient client;
    private final ModelRegistryClient modelRegistry;
    private final String routerName;
    private final String embeddingsName;

    OpenAiModelsHandler(ObjectMapper objectMapper, BackendRegistry registry, BackendClient client,
                        ModelRegistryClient modelRegistry, String routerName, String embeddingsName) {
        super(objectMapper);
        this.registry = registry;
        this.client = client;
        this.modelRegistry = modelRegistry;
        this.routerName = routerName;
        this.embeddingsName = embeddingsName;
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws Exception {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        ArrayNode data = objectMapper.createArrayNode();
        Set<String> seen = new HashSet<>();
        addRouterModels(data, seen);
        addEmbeddingModels(data, seen);

        ObjectNode body = objectMapper.createObjectNode();
        body.put("object", "list");
        body.set("data", data);
        HttpExchanges.sendJson(exchange, objectMapper, 200, body);
    }

    private void addRouterModels(ArrayNode data, Set<String> seen) {
        try {
            Backend router = registry.require(routerName);
            for (ModelView view : modelRegistry.listLogicalModels(router)) {
                if (!seen.add(view.id())) {
                    continue;
                }
                ObjectNode entry = data.addObject();
                entry.put("id", view.id());
                entry.put("object", "model");
                entry.put("owned_by", routerName);
                entry.put("status", view.status().wireValue());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to list router models: backend={}, error={}", routerName, e.getMessage());
        }
    }

    private void addEmbeddingModels(ArrayNode data, Set<String> seen) {
        try {
            Backend embeddings = registry.require(embeddingsName);
            BackendResponse response = client.request(embeddings.name(), "GET", embeddings.resolve(PATH),
                    TimeoutClass.DEFAULT, 1, null, Map.of());
            if (!response.isSuccess()) {
                log.warn("Embeddings model list failed: backend={}, status={}", embeddingsName, response.statusCode());
                return;
            }
            JsonNode models = objectMapper.readTree(response.body()).path("data");
            for (JsonNode model : models) {
                String id = model.path("id").asText("");
                if (model.isObject() && !id.isEmpty() && seen.add(id)) {
                    data.add(model);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to list embedding models: backend={}, error={}", embeddingsName, e.getMessage());
        }
    }
}
