package fr.lapetina.synapse.gateway.infrastructure.http;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.synapse.gateway.domain.model.HealthStatus;
import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendClientTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger hits = new AtomicInteger();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private MetricsRegistry metrics;
    private BackendClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> {
            hits.incrementAndGet();
            respond(exchange, 200, "application/json", "{\"ok\":true}");
        });
        server.createContext("/boom", exchange -> {
            hits.incrementAndGet();
            respond(exchange, 500, "text/plain", "upstream exploded");
        });
        server.createContext("/slow", exchange -> {
            hits.incrementAndGet();
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "text/plain", "late");
        });
        server.createContext("/health", exchange -> respond(exchange, 200, "text/plain", "ok"));
        server.createContext("/sick", exchange -> respond(exchange, 503, "text/plain", "warming up"));
        server.createContext("/stream", exchange -> {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write("data: one\n\n".getBytes(StandardCharsets.UTF_8));
                os.flush();
                os.write("data: [DONE]\n\n".getBytes(StandardCharsets.UTF_8));
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        metrics = new MetricsRegistry("test", false);
        client = newClient(5);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        metrics.close();
    }

    private BackendClient newClient(int failureThreshold) {
        return BackendClient.builder()
                .connectTimeout(Duration.ofSeconds(2))
                .timeout(TimeoutClass.DEFAULT, Duration.ofMillis(300))
                .circuitBreaker(failureThreshold, Duration.ofMinutes(5))
                .healthCheckTimeout(Duration.ofSeconds(2))
                .sleeper(sleeps::add)
                .metrics(metrics)
                .build();
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String type, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", type);
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

    @Nested
    @DisplayName("request")
    class Request {

        @Test
        @DisplayName("should return a successful answer and keep the breaker closed")
        void shouldReturnSuccess() {
            BackendResponse response = client.request("llm", "GET", baseUrl + "/ok", TimeoutClass.DEFAULT, null, Map.of());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.isJson()).isTrue();
            assertThat(response.bodyAsString()).isEqualTo("{\"ok\":true}");
            assertThat(client.getCircuitBreaker("llm").getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("should return HTTP errors after a single attempt without touching the breaker")
        void shouldNotRetryHttpErrors() {
            BackendResponse response = client.request("llm", "POST", baseUrl + "/boom", TimeoutClass.DEFAULT,
                    "{}".getBytes(StandardCharsets.UTF_8), Map.of("Content-Type", "application/json"));

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.bodyAsString()).isEqualTo("upstream exploded");
            assertThat(hits.get()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
            assertThat(client.getCircuitBreaker("llm").getFailureCount()).isZero();
        }

        @Test
        @DisplayName("should retry connect failures with exponential backoff then give up")
        void shouldRetryConnectFailures() throws IOException {
            String url = closedPortUrl() + "/v1/chat/completions";

            assertThatThrownBy(() -> client.request("llm", "POST", url, TimeoutClass.DEFAULT, null, Map.of()))
                    .isInstanceOf(BackendUnavailableException.class)
                    .satisfies(e -> assertThat(((BackendUnavailableException) e).isCircuitOpen()).isFalse());

            assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(1000));
            assertThat(client.getCircuitBreaker("llm").getFailureCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should honor an explicit attempt count")
        void shouldHonorExplicitAttempts() throws IOException {
            String url = closedPortUrl();

            assertThatThrownBy(() -> client.request("stt", "GET", url, TimeoutClass.DEFAULT, 1, null, Map.of()))
                    .isInstanceOf(BackendUnavailableException.class);

            assertThat(sleeps).isEmpty();
            assertThat(client.getCircuitBreaker("stt").getFailureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should fail fast without a network call once the breaker is open")
        void shouldFailFastWhenOpen() throws IOException {
            BackendClient fragile = newClient(2);
            String deadUrl = closedPortUrl();
            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> fragile.request("tts", "GET", deadUrl, TimeoutClass.DEFAULT, 1, null, Map.of()))
                        .isInstanceOf(BackendUnavailableException.class);
            }

            assertThatThrownBy(() -> fragile.request("tts", "GET", baseUrl + "/ok", TimeoutClass.DEFAULT, null, Map.of()))
                    .isInstanceOf(BackendUnavailableException.class)
                    .satisfies(e -> assertThat(((BackendUnavailableException) e).isCircuitOpen()).isTrue());
            assertThat(hits.get()).isZero();
        }

        @Test
        @DisplayName("should map a read timeout to BackendTimeoutException without retrying")
        void shouldMapTimeout() {
            assertThatThrownBy(() -> client.request("llm", "GET", baseUrl + "/slow", TimeoutClass.DEFAULT, null, Map.of()))
                    .isInstanceOf(BackendTimeoutException.class);

            assertThat(hits.get()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("should drop headers the HTTP client manages itself")
        void shouldDropRestrictedHeaders() {
            BackendResponse response = client.request("llm", "GET", baseUrl + "/ok", TimeoutClass.DEFAULT, null,
                    Map.of("Host", "evil.example", "Connection", "close", "X-Request-ID", "abc"));

            assertThat(response.statusCode()).isEqualTo(200);
        }
    }

    @Nested
    @DisplayName("stream")
    class Stream {

        @Test
        @DisplayName("should relay the upstream body chunk by chunk")
        void shouldRelayBody() throws IOException {
            ByteArrayOutputStream sink = new ByteArrayOutputStream();
            try (BackendStream stream = client.stream("llm", "POST", baseUrl + "/stream", TimeoutClass.DEFAULT,
                    "{}".getBytes(StandardCharsets.UTF_8), Map.of())) {
                assertThat(stream.getStatusCode()).isEqualTo(200);
                assertThat(stream.contentType()).isEqualTo("text/event-stream");
                stream.relayTo(sink);
            }

            assertThat(sink.toString(StandardCharsets.UTF_8)).isEqualTo("data: one\n\ndata: [DONE]\n\n");
        }

        @Test
        @DisplayName("should not retry a stream that cannot connect")
        void shouldNotRetryStream() throws IOException {
            String url = closedPortUrl();

            assertThatThrownBy(() -> client.stream("llm", "POST", url, TimeoutClass.DEFAULT, null, Map.of()))
                    .isInstanceOf(BackendUnavailableException.class);
            assertThat(sleeps).isEmpty();
            assertThat(client.getCircuitBreaker("llm").getFailureCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("healthCheck")
    class HealthCheck {

        @Test
        @DisplayName("should report healthy on 200")
        void shouldReportHealthy() {
            HealthResult result = client.healthCheck("llm", baseUrl + "/health").join();

            assertThat(result.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(result.code()).isEqualTo(200);
            assertThat(result.error()).isNull();
        }

        @Test
        @DisplayName("should report unhealthy with the status code on any other answer")
        void shouldReportUnhealthy() {
            HealthResult result = client.healthCheck("llm", baseUrl + "/sick").join();

            assertThat(result.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(result.code()).isEqualTo(503);
        }

        @Test
        @DisplayName("should report unreachable instead of failing")
        void shouldReportUnreachable() throws IOException {
            HealthResult result = client.healthCheck("llm", closedPortUrl() + "/health").join();

            assertThat(result.status()).isEqualTo(HealthStatus.UNREACHABLE);
            assertThat(result.error()).isNotBlank();
        }
    }

    @Test
    @DisplayName("should detect connect failures anywhere in the cause chain")
    void shouldDetectWrappedConnectFailure() {
        IOException wrapped = new IOException("send failed", new ConnectException("Connection refused"));

        assertThat(BackendClient.isConnectFailure(wrapped)).isTrue();
        assertThat(BackendClient.isConnectFailure(new IOException("reset"))).isFalse();
    }

    @Test
    @DisplayName("should compute capped exponential backoff delays")
    void shouldComputeBackoff() {
        RetryPolicy policy = RetryPolicy.DEFAULT;

        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.delayAfter(0)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.delayAfter(5)).isEqualTo(Duration.ofMillis(2000));
    }
}
