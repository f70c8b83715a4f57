package fr.lapetina.synapse.gateway.infrastructure.health;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.model.HealthStatus;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.HealthResult;
import fr.lapetina.synapse.gateway.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class HealthAggregatorTest {

    private HttpServer server;
    private String baseUrl;
    private MetricsRegistry metrics;
    private BackendRegistry registry;
    private HealthAggregator aggregator;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/health", exchange -> respond(exchange, 200, "ok"));
        server.createContext("/warming", exchange -> respond(exchange, 503, "loading"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        metrics = new MetricsRegistry("test", false);
        registry = new BackendRegistry();
        BackendClient client = BackendClient.builder()
                .healthCheckTimeout(Duration.ofSeconds(2))
                .metrics(metrics)
                .build();
        aggregator = new HealthAggregator(registry, client, metrics, Duration.ZERO);
    }

    @AfterEach
    void tearDown() {
        aggregator.close();
        server.stop(0);
        metrics.close();
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String closedPortUrl() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return "http://127.0.0.1:" + socket.getLocalPort();
        }
    }

    private double gauge(String backend) {
        return metrics.getRegistry().get("test_backend_health").tag("backend", backend).gauge().value();
    }

    @Test
    @DisplayName("should report healthy when every backend answers 200")
    void shouldReportHealthy() {
        registry.register(new Backend("llama-router", baseUrl, "/health"));
        registry.register(new Backend("llama-embed", baseUrl, null));

        GatewayHealth health = aggregator.checkAll().join();

        assertThat(health.status()).isEqualTo(GatewayHealth.HEALTHY);
        assertThat(health.backends()).containsOnlyKeys("llama-router", "llama-embed");
        assertThat(health.backends().values()).allMatch(HealthResult::isHealthy);
    }

    @Test
    @DisplayName("should degrade only the failing entries")
    void shouldDegradeFailingEntries() throws IOException {
        registry.register(new Backend("llama-router", baseUrl, "/health"));
        registry.register(new Backend("whisper", baseUrl, "/warming"));
        registry.register(new Backend("tts", closedPortUrl(), "/health"));

        GatewayHealth health = aggregator.checkAll().join();

        assertThat(health.status()).isEqualTo(GatewayHealth.DEGRADED);
        assertThat(health.backends().get("llama-router").status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.backends().get("whisper").status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(health.backends().get("whisper").code()).isEqualTo(503);
        assertThat(health.backends().get("tts").status()).isEqualTo(HealthStatus.UNREACHABLE);
        assertThat(health.backends().get("tts").error()).isNotBlank();
    }

    @Test
    @DisplayName("should store the last result in the registry and expose a gauge")
    void shouldRecordLastHealth() throws IOException {
        registry.register(new Backend("llama-router", baseUrl, "/health"));
        registry.register(new Backend("tts", closedPortUrl(), "/health"));

        aggregator.checkAll().join();

        assertThat(registry.getLastHealth("llama-router")).map(HealthResult::status).contains(HealthStatus.HEALTHY);
        assertThat(registry.getLastHealth("tts")).map(HealthResult::status).contains(HealthStatus.UNREACHABLE);
        assertThat(gauge("llama-router")).isEqualTo(2.0);
        assertThat(gauge("tts")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("should report healthy with no backends registered")
    void shouldHandleEmptyRegistry() {
        GatewayHealth health = aggregator.checkAll().join();

        assertThat(health.status()).isEqualTo(GatewayHealth.HEALTHY);
        assertThat(health.backends()).isEmpty();
    }

    @Test
    @DisplayName("should forget the last health of a removed backend")
    void shouldForgetRemovedBackend() {
        List<BackendRegistry.RegistryEvent> events = new CopyOnWriteArrayList<>();
        registry.addListener(events::add);
        registry.register(new Backend("llama-router", baseUrl, "/health"));
        aggregator.checkAll().join();

        registry.remove("llama-router");

        assertThat(registry.getLastHealth("llama-router")).isEmpty();
        assertThat(events).extracting(BackendRegistry.RegistryEvent::type)
                .containsExactly(BackendRegistry.RegistryEvent.Type.ADDED, BackendRegistry.RegistryEvent.Type.REMOVED);
    }
}
