package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.infrastructure.health.BackendRegistry;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendResponse;

import java.util.Map;

/**
 * POST /v1/embeddings, forwarded unchanged to the embeddings backend.
 */
final class EmbeddingsHandler extends GatewayHandler {

    static final String PATH = "/v1/embeddings";

    private final BackendRegistry registry;
    private final BackendClient client;
    private final String backendName;

    EmbeddingsHandler(ObjectMapper objectMapper, BackendRegistry registry, BackendClient client, String backendName) {
        super(objectMapper);
        this.registry = registry;
        this.client = client;
        this.backendName = backendName;
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws Exception {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        byte[] body = HttpExchanges.readBody(exchange);
        Backend backend = registry.require(backendName);
        BackendResponse response = client.request(backend.name(), "POST", backend.resolve(PATH),
                TimeoutClass.EMBEDDINGS, body, Map.of("Content-Type", HttpExchanges.JSON));
        relay(exchange, response, "Embeddings backend error");
    }
}
