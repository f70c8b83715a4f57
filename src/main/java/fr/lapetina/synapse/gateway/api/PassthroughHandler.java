package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.infrastructure.health.BackendRegistry;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendResponse;

/**
 * Forwards everything under a configured prefix to one backend, prefix stripped.
 * {@code /tts/v1/audio/speech?x=1} on prefix {@code /tts} becomes {@code /v1/audio/speech?x=1}.
 */
final class PassthroughHandler extends GatewayHandler {

    private final String prefix;
    private final String backendName;
    private final TimeoutClass timeoutClass;
    private final BackendRegistry registry;
    private final BackendClient client;

    PassthroughHandler(ObjectMapper objectMapper, String prefix, String backendName, TimeoutClass timeoutClass,
                       BackendRegistry registry, BackendClient client) {
        super(objectMapper);
        this.prefix = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        this.backendName = backendName;
        this.timeoutClass = timeoutClass;
        this.registry = registry;
        this.client = client;
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws Exception {
        String rawPath = exchange.getRequestURI().getRawPath();
        if (!rawPath.equals(prefix) && !rawPath.startsWith(prefix + "/")) {
            HttpExchanges.sendError(exchange, objectMapper, 404, "Not Found");
            return;
        }
        String method = exchange.getRequestMethod().toUpperCase();
        byte[] body = "GET".equals(method) || "HEAD".equals(method) ? null : HttpExchanges.readBody(exchange);

        Backend backend = registry.require(backendName);
        BackendResponse response = client.request(backend.name(), method, backend.resolve(targetPath(exchange)),
                timeoutClass, body, forwardHeaders(exchange));
        relay(exchange, response, "Backend error: " + backendName);
    }

    String targetPath(HttpExchange exchange) {
        String remainder = exchange.getRequestURI().getRawPath().substring(prefix.length());
        if (remainder.isEmpty()) {
            remainder = "/";
        }
        String query = exchange.getRequestURI().getRawQuery();
        return query == null ? remainder : remainder + "?" + query;
    }
}
