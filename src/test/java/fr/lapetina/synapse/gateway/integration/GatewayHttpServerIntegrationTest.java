package fr.lapetina.synapse.gateway.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.synapse.gateway.api.GatewayHttpServer;
import fr.lapetina.synapse.gateway.testing.FakeLlamaRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests through the real HTTP server against a stub llama router.
 * Configuration is externalized to test-gateway.yaml.
 */
class GatewayHttpServerIntegrationTest {

    private static final String GENERAL = "gpt-oss-20b";
    private static final String CODER = "Qwen3-Coder-30B";

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    private FakeLlamaRouter router;
    private TestGatewayFactory factory;
    private GatewayHttpServer server;
    private String base;

    @BeforeEach
    void setUp() throws IOException {
        router = new FakeLlamaRouter().model(GENERAL, "loaded").model(CODER, "unloaded");
        factory = TestGatewayFactory.create(
                Map.of("llama-router", router.baseUrl(), "llama-embed", router.baseUrl(), "tts", closedPortUrl()),
                dir.resolve("model_profiles.json"));
        server = new GatewayHttpServer(factory);
        server.start();
        base = "http://127.0.0.1:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        if (factory != null) {
            factory.close();
        }
        if (router != null) {
            router.close();
        }
    }

    private static String closedPortUrl() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return "http://127.0.0.1:" + socket.getLocalPort();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(base + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> send(String method, String path, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(base + path))
                .header("Content-Type", "application/json")
                .header("X-Request-ID", "req-42")
                .method(method, HttpRequest.BodyPublishers.ofString(json))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("should report health with one entry per backend")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("status").asText()).isEqualTo("degraded");
        assertThat(body.path("backends").has("llama-router")).isTrue();
        assertThat(body.path("backends").has("tts")).isTrue();
    }

    @Nested
    @DisplayName("chat completions")
    class Chat {

        @Test
        @DisplayName("should route a coding question to the coder model with its profile applied")
        void shouldRouteAutoRequestToCoder() throws Exception {
            HttpResponse<String> saved = send("PUT", "/models/" + CODER + "/profile",
                    "{\"values\":{\"temperature\":0.3,\"system_prompt\":\"You are a careful engineer.\"}}");
            assertThat(saved.statusCode()).isEqualTo(200);

            HttpResponse<String> response = send("POST", "/v1/chat/completions",
                    "{\"model\":\"auto\",\"messages\":[{\"role\":\"user\",\"content\":\"Why does my Java code throw an exception?\"}]}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("X-Request-ID")).contains("req-42");
            assertThat(mapper.readTree(response.body()).path("model").asText()).isEqualTo(CODER);

            assertThat(router.unloads()).containsExactly(GENERAL);
            assertThat(router.loads()).containsExactly(CODER);
            JsonNode forwarded = router.chatRequests().get(0);
            assertThat(forwarded.path("temperature").asDouble()).isEqualTo(0.3);
            assertThat(forwarded.path("messages").get(0).path("content").asText())
                    .isEqualTo("You are a careful engineer.");
        }

        @Test
        @DisplayName("should relay a streamed answer as server-sent events")
        void shouldStream() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/chat/completions",
                    "{\"model\":\"" + GENERAL + "\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                    type -> assertThat(type).startsWith("text/event-stream"));
            assertThat(response.body()).contains("data: [DONE]");
            assertThat(router.loads()).isEmpty();
        }

        @Test
        @DisplayName("should answer 400 for an unknown model")
        void shouldRejectUnknownModel() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/chat/completions",
                    "{\"model\":\"nope\",\"messages\":[]}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(mapper.readTree(response.body()).path("reason").asText()).isEqualTo("unknown_model");
        }

        @Test
        @DisplayName("should answer 400 for a malformed body")
        void shouldRejectMalformedBody() throws Exception {
            HttpResponse<String> response = send("POST", "/v1/chat/completions", "{not json");

            assertThat(response.statusCode()).isEqualTo(400);
        }
    }

    @Nested
    @DisplayName("models and profiles")
    class Models {

        @Test
        @DisplayName("should list router models in OpenAI format")
        void shouldListOpenAiModels() throws Exception {
            HttpResponse<String> response = get("/v1/models");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.path("object").asText()).isEqualTo("list");
            assertThat(body.path("data").findValuesAsText("id")).contains(GENERAL, CODER);
        }

        @Test
        @DisplayName("should list the registry with family information")
        void shouldListRegistry() throws Exception {
            HttpResponse<String> response = get("/models");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains(GENERAL).contains("gpt-oss");
            JsonNode entry = mapper.readTree(response.body()).path("data").get(0);
            assertThat(entry.path("runtime_hints").path("runtime_ctx_size").asInt()).isEqualTo(8192);
        }

        @Test
        @DisplayName("should store, merge and return profile values")
        void shouldRoundTripProfile() throws Exception {
            send("PUT", "/models/" + GENERAL + "/profile", "{\"values\":{\"temperature\":0.5}}");
            send("PUT", "/models/" + GENERAL + "/profile", "{\"values\":{\"reasoning_effort\":\"HIGH\"}}");

            HttpResponse<String> response = get("/models/" + GENERAL + "/profile");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.path("family").asText()).isEqualTo("gpt-oss");
            assertThat(body.path("values").path("temperature").asDouble()).isEqualTo(0.5);
            assertThat(body.path("values").path("reasoning_effort").asText()).isEqualTo("high");
        }

        @Test
        @DisplayName("should reject invalid profile values")
        void shouldRejectInvalidProfile() throws Exception {
            HttpResponse<String> response = send("PUT", "/models/" + GENERAL + "/profile",
                    "{\"values\":{\"temperature\":9}}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(get("/models/" + GENERAL + "/profile").body()).doesNotContain("\"temperature\"");
        }

        @Test
        @DisplayName("should serve the schema of a model family")
        void shouldServeSchema() throws Exception {
            HttpResponse<String> response = get("/models/Qwen3-8B/schema");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("enable_thinking").doesNotContain("reasoning_effort");
        }
    }

    @Test
    @DisplayName("should answer 503 when a passthrough backend is down")
    void shouldReportUnavailableBackend() throws Exception {
        HttpResponse<String> response = send("POST", "/tts/speak", "{\"text\":\"hello\"}");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(mapper.readTree(response.body()).path("error").asText()).isEqualTo("Backend unavailable");
    }

    @Test
    @DisplayName("should expose feed counters and metrics")
    void shouldExposeStatsAndMetrics() throws Exception {
        HttpResponse<String> stats = get("/events/terminal/stats");
        HttpResponse<String> metrics = get("/metrics");

        assertThat(stats.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(stats.body()).has("subscriber_count")).isTrue();
        assertThat(metrics.statusCode()).isEqualTo(200);
        assertThat(metrics.body()).contains("synapse_test");
    }
}
