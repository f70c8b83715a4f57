package fr.lapetina.synapse.gateway.testing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Loopback stand-in for a llama.cpp router: a model registry with load and unload
 * commands plus an OpenAI-style chat endpoint that records what it received.
 */
public final class FakeLlamaRouter implements AutoCloseable {

    public enum LoadBehaviour {
        /** The model is loaded as soon as the load command is accepted. */
        INSTANT,
        /** The model stays loading until the test changes its status. */
        DEFERRED,
        /** The router flags the load as failed. */
        FAIL
    }

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpServer server;
    private final Map<String, String> statuses = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Boolean> failures = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<String> loads = new CopyOnWriteArrayList<>();
    private final List<String> unloads = new CopyOnWriteArrayList<>();
    private final List<JsonNode> chatRequests = new CopyOnWriteArrayList<>();

    private volatile LoadBehaviour loadBehaviour = LoadBehaviour.INSTANT;
    private volatile int loadStatus = 200;
    private volatile boolean registryReadable = true;
    private volatile boolean bareRegistry;
    private final AtomicBoolean closed = new AtomicBoolean();

    public FakeLlamaRouter() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/health", exchange -> respond(exchange, 200, "application/json", "{\"status\":\"ok\"}"));
        server.createContext("/models", this::handleModels);
        server.createContext("/v1/chat/completions", this::handleChat);
        server.start();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public FakeLlamaRouter model(String id, String status) {
        statuses.put(id, status);
        failures.put(id, false);
        return this;
    }

    public void setStatus(String id, String status) {
        statuses.put(id, status);
    }

    public String status(String id) {
        return statuses.get(id);
    }

    public void setLoadBehaviour(LoadBehaviour loadBehaviour) {
        this.loadBehaviour = loadBehaviour;
    }

    public void setLoadStatus(int loadStatus) {
        this.loadStatus = loadStatus;
    }

    /**
     * While unreadable, {@code GET /models} drops the connection without answering.
     */
    public void setRegistryReadable(boolean registryReadable) {
        this.registryReadable = registryReadable;
    }

    /**
     * Serves the registry as a bare JSON array instead of {@code {"data": [...]}}.
     */
    public void setBareRegistry(boolean bareRegistry) {
        this.bareRegistry = bareRegistry;
    }

    public List<String> loads() {
        return List.copyOf(loads);
    }

    public List<String> unloads() {
        return List.copyOf(unloads);
    }

    public List<JsonNode> chatRequests() {
        return List.copyOf(chatRequests);
    }

    private void handleModels(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if ("GET".equals(exchange.getRequestMethod()) && "/models".equals(path)) {
            if (!registryReadable) {
                exchange.close();
                return;
            }
            ObjectNode registry = registry();
            respond(exchange, 200, "application/json",
                    mapper.writeValueAsString(bareRegistry ? registry.get("data") : registry));
            return;
        }
        JsonNode body = mapper.readTree(exchange.getRequestBody().readAllBytes());
        String model = body.path("model").asText();
        if ("/models/load".equals(path)) {
            loads.add(model);
            if (loadStatus != 200) {
                respond(exchange, loadStatus, "application/json", "{\"error\":\"busy\"}");
                return;
            }
            for (String member : group(model)) {
                switch (loadBehaviour) {
                    case INSTANT:
                        statuses.put(member, "loaded");
                        break;
                    case DEFERRED:
                        statuses.put(member, "loading");
                        break;
                    case FAIL:
                    default:
                        statuses.put(member, "unloaded");
                        failures.put(member, true);
                        break;
                }
            }
            respond(exchange, 200, "application/json", "{\"success\":true}");
        } else if ("/models/unload".equals(path)) {
            unloads.add(model);
            statuses.put(model, "unloaded");
            respond(exchange, 200, "application/json", "{\"success\":true}");
        } else {
            respond(exchange, 404, "text/plain", "not found");
        }
    }

    private void handleChat(HttpExchange exchange) throws IOException {
        JsonNode body = mapper.readTree(exchange.getRequestBody().readAllBytes());
        chatRequests.add(body);
        String model = body.path("model").asText();
        if (body.path("stream").asBoolean(false)) {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(("data: {\"model\":\"" + model + "\",\"choices\":[{\"delta\":{\"content\":\"hi\"}}]}\n\n")
                        .getBytes(StandardCharsets.UTF_8));
                os.flush();
                os.write("data: [DONE]\n\n".getBytes(StandardCharsets.UTF_8));
            }
            return;
        }
        ObjectNode reply = mapper.createObjectNode();
        reply.put("object", "chat.completion");
        reply.put("model", model);
        reply.putArray("choices").addObject().putObject("message")
                .put("role", "assistant").put("content", "hello");
        respond(exchange, 200, "application/json", mapper.writeValueAsString(reply));
    }

    private ObjectNode registry() {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode data = root.putArray("data");
        synchronized (statuses) {
            statuses.forEach((id, status) -> {
                ObjectNode entry = data.addObject();
                entry.put("id", id);
                ObjectNode state = entry.putObject("status");
                state.put("value", status);
                state.put("failed", failures.getOrDefault(id, false));
                state.putArray("args").add("--ctx-size").add("8192");
            });
        }
        return root;
    }

    /**
     * Every part of a split model when {@code id} is one of its parts, otherwise the id alone.
     */
    private List<String> group(String id) {
        int of = id.lastIndexOf("-of-");
        int dash = of > 0 ? id.lastIndexOf('-', of - 1) : -1;
        if (dash < 0) {
            return List.of(id);
        }
        String prefix = id.substring(0, dash + 1);
        String suffix = id.substring(of);
        List<String> members = new ArrayList<>();
        synchronized (statuses) {
            for (String candidate : statuses.keySet()) {
                if (candidate.startsWith(prefix) && candidate.endsWith(suffix)) {
                    members.add(candidate);
                }
            }
        }
        return members.isEmpty() ? List.of(id) : members;
    }

    private static void respond(HttpExchange exchange, int status, String type, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", type);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            server.stop(0);
        }
    }
}
