package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response and request helpers shared by the handlers.
 */
final class HttpExchanges {

    static final String JSON = "application/json";

    private HttpExchanges() {
    }

    static void sendJson(HttpExchange exchange, ObjectMapper mapper, int statusCode, Object body) throws IOException {
        sendBytes(exchange, statusCode, JSON, mapper.writeValueAsBytes(body));
    }

    static void sendError(HttpExchange exchange, ObjectMapper mapper, int statusCode, String message) throws IOException {
        sendJson(exchange, mapper, statusCode, Map.of("error", message));
    }

    static void sendBytes(HttpExchange exchange, int statusCode, String contentType, byte[] bytes) throws IOException {
        if (contentType != null) {
            exchange.getResponseHeaders().set("Content-Type", contentType);
        }
        // JDK server: -1 means no body, 0 would switch to chunked encoding
        exchange.sendResponseHeaders(statusCode, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    static byte[] readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return is.readAllBytes();
        }
    }

    static boolean headersSent(HttpExchange exchange) {
        return exchange.getResponseCode() != -1;
    }

    /**
     * Decodes the query string; repeated keys keep their first value.
     */
    static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new LinkedHashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return params;
        }
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            params.putIfAbsent(key, value);
        }
        return params;
    }

    static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
