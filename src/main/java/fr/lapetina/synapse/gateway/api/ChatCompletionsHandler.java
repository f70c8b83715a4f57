package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.infrastructure.health.BackendRegistry;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendResponse;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendStream;
import fr.lapetina.synapse.gateway.orchestration.ChatCompletionPreparer;
import fr.lapetina.synapse.gateway.orchestration.PreparedChat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * POST /v1/chat/completions: model selection, load orchestration and profile merge,
 * then a buffered or streamed forward to the LLM router.
 */
final class ChatCompletionsHandler extends GatewayHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionsHandler.class);

    static final String PATH = "/v1/chat/completions";
    private static final String ERROR_LABEL = "LLM backend error";

    private final BackendRegistry registry;
    private final BackendClient client;
    private final ChatCompletionPreparer preparer;
    private final String routerName;

    ChatCompletionsHandler(ObjectMapper objectMapper, BackendRegistry registry, BackendClient client,
                           ChatCompletionPreparer preparer, String routerName) {
        super(objectMapper);
        this.registry = registry;
        this.client = client;
        this.preparer = preparer;
        this.routerName = routerName;
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws Exception {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        ObjectNode payload = readJsonObject(exchange);
        Backend router = registry.require(routerName);

        PreparedChat prepared = preparer.prepare(router, payload);
        byte[] body = objectMapper.writeValueAsBytes(prepared.payload());
        Map<String, String> headers = Map.of("Content-Type", HttpExchanges.JSON);
        String url = router.resolve(PATH);

        if (!prepared.isStream()) {
            BackendResponse response = client.request(router.name(), "POST", url, TimeoutClass.LLM, body, headers);
            relay(exchange, response, ERROR_LABEL);
            return;
        }

        try (BackendStream stream = client.stream(router.name(), "POST", url, TimeoutClass.LLM, body, headers)) {
            if (stream.getStatusCode() >= 400) {
                BackendResponse buffered = new BackendResponse(
                        stream.getStatusCode(), stream.getHeaders(), stream.readAll());
                relay(exchange, buffered, ERROR_LABEL);
                return;
            }
            exchange.getResponseHeaders().set("Content-Type", stream.header("Content-Type").orElse("text/event-stream"));
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.getResponseHeaders().set("X-Accel-Buffering", "no");
            exchange.sendResponseHeaders(stream.getStatusCode(), 0);
            try {
                long relayed = stream.relayTo(exchange.getResponseBody());
                log.debug("Chat stream finished: model={}, bytes={}", prepared.model(), relayed);
            } catch (IOException e) {
                // Closing the stream below releases the upstream connection
                log.info("Chat stream aborted: model={}, error={}", prepared.model(), e.getMessage());
            }
        }
    }
}
