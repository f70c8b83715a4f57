package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.synapse.gateway.domain.profile.RequestValidationException;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base for every route: assigns the request id, maps exceptions to the error envelope
 * and offers the upstream relay helpers.
 */
abstract class GatewayHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayHandler.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    protected final ObjectMapper objectMapper;

    protected GatewayHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public final void handle(HttpExchange exchange) throws IOException {
        String requestId = exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        MDC.put("requestId", requestId);
        exchange.getResponseHeaders().set(REQUEST_ID_HEADER, requestId);

        try {
            doHandle(exchange);
        } catch (Exception e) {
            handleFailure(exchange, e);
        } finally {
            exchange.close();
            MDC.clear();
        }
    }

    protected abstract void doHandle(HttpExchange exchange) throws Exception;

    private void handleFailure(HttpExchange exchange, Exception e) throws IOException {
        ErrorMapper.ApiError error = ErrorMapper.map(e);
        String path = exchange.getRequestURI().getPath();
        if (error.unexpected()) {
            log.error("Unhandled error: method={}, path={}", exchange.getRequestMethod(), path, e);
        } else if (error.status() >= 500) {
            log.warn("Request failed: method={}, path={}, status={}, error={}",
                    exchange.getRequestMethod(), path, error.status(), e.getMessage());
        } else {
            log.debug("Request rejected: method={}, path={}, status={}, error={}",
                    exchange.getRequestMethod(), path, error.status(), e.getMessage());
        }
        if (HttpExchanges.headersSent(exchange)) {
            // Body already streaming; the client sees a truncated response
            return;
        }
        HttpExchanges.sendJson(exchange, objectMapper, error.status(), error.body());
    }

    protected boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", method);
        HttpExchanges.sendError(exchange, objectMapper, 405, "Method Not Allowed");
        return false;
    }

    protected ObjectNode readJsonObject(HttpExchange exchange) throws IOException {
        byte[] body = HttpExchanges.readBody(exchange);
        if (body.length == 0) {
            throw new RequestValidationException("Request body must be a JSON object");
        }
        JsonNode node = objectMapper.readTree(body);
        if (node == null || !node.isObject()) {
            throw new RequestValidationException("Request body must be a JSON object");
        }
        return (ObjectNode) node;
    }

    /**
     * Sends a buffered upstream answer to the client. Failed answers keep their status;
     * a JSON body is passed as-is, anything else is wrapped in the error envelope.
     */
    protected void relay(HttpExchange exchange, BackendResponse response, String errorLabel) throws IOException {
        if (response.isSuccess() || response.isJson()) {
            String contentType = response.contentType();
            HttpExchanges.sendBytes(exchange, response.statusCode(),
                    contentType != null ? contentType : HttpExchanges.JSON, response.body());
            return;
        }
        HttpExchanges.sendJson(exchange, objectMapper, response.statusCode(),
                ErrorMapper.upstreamError(errorLabel, response));
    }

    /**
     * Headers forwarded to a backend: the content type of the inbound request plus the request id.
     */
    protected static Map<String, String> forwardHeaders(HttpExchange exchange) {
        Map<String, String> headers = new LinkedHashMap<>();
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        if (contentType != null) {
            headers.put("Content-Type", contentType);
        }
        String accept = exchange.getRequestHeaders().getFirst("Accept");
        if (accept != null) {
            headers.put("Accept", accept);
        }
        String requestId = MDC.get("requestId");
        if (requestId != null) {
            headers.put(REQUEST_ID_HEADER, requestId);
        }
        return headers;
    }
}
