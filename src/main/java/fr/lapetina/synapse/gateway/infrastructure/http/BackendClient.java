package fr.lapetina.synapse.gateway.infrastructure.http;

import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatch client shared by every route talking to a backend.
 *
 * Uses one pooled java.net.http.HttpClient for the whole process and one circuit
 * breaker per backend name. Only connect-class failures (refused connection, connect
 * timeout) count against the breaker and are retried; any HTTP status is a success
 * from the breaker's point of view and is returned as-is.
 */
public class BackendClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendClient.class);

    // Managed by HttpClient itself, rejected when set explicitly.
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade",
            "transfer-encoding", "keep-alive", "te", "trailer", "proxy-connection"
    );

    private final HttpClient httpClient;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final Map<TimeoutClass, Duration> timeouts;
    private final RetryPolicy retryPolicy;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Duration healthCheckTimeout;
    private final Sleeper sleeper;
    private final MetricsRegistry metrics;

    private BackendClient(Builder builder) {
        this.timeouts = new EnumMap<>(TimeoutClass.class);
        for (TimeoutClass timeoutClass : TimeoutClass.values()) {
            this.timeouts.put(timeoutClass,
                    builder.timeouts.getOrDefault(timeoutClass, timeoutClass.getDefaultDuration()));
        }
        this.retryPolicy = builder.retryPolicy;
        this.failureThreshold = builder.failureThreshold;
        this.cooldown = builder.cooldown;
        this.healthCheckTimeout = builder.healthCheckTimeout;
        this.sleeper = builder.sleeper;
        this.metrics = Objects.requireNonNull(builder.metrics, "MetricsRegistry is required");

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        log.info("BackendClient initialized: connectTimeoutMs={}, maxAttempts={}, failureThreshold={}, cooldownMs={}",
                builder.connectTimeout.toMillis(), retryPolicy.maxAttempts(), failureThreshold, cooldown.toMillis());
    }

    /**
     * Sends a request using the configured number of attempts.
     */
    public BackendResponse request(
            String backendName,
            String method,
            String url,
            TimeoutClass timeoutClass,
            byte[] body,
            Map<String, String> headers
    ) {
        return request(backendName, method, url, timeoutClass, retryPolicy.maxAttempts(), body, headers);
    }

    /**
     * Sends a request and buffers the whole answer.
     *
     * @param maxRetries total number of attempts, retries included
     * @throws BackendUnavailableException circuit open, or connect-class failure on every attempt
     * @throws BackendTimeoutException     the backend accepted the connection but did not answer in time
     * @throws BackendException            any other transport failure
     */
    public BackendResponse request(
            String backendName,
            String method,
            String url,
            TimeoutClass timeoutClass,
            int maxRetries,
            byte[] body,
            Map<String, String> headers
    ) {
        CircuitBreaker breaker = getOrCreateCircuitBreaker(backendName);
        int attempts = Math.max(1, maxRetries);
        BackendUnavailableException lastFailure = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            checkCircuit(backendName, breaker);
            HttpRequest httpRequest = buildRequest(backendName, method, url, timeoutClass, body, headers);
            Instant start = Instant.now();

            try {
                HttpResponse<byte[]> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
                breaker.recordSuccess();
                Duration latency = Duration.between(start, Instant.now());
                metrics.incrementBackendRequest(backendName, "success");
                metrics.recordBackendLatency(backendName, latency);
                log.debug("Backend answered: backend={}, method={}, url={}, status={}, attempt={}, latencyMs={}",
                        backendName, method, url, response.statusCode(), attempt, latency.toMillis());
                return new BackendResponse(response.statusCode(), response.headers().map(), response.body());

            } catch (IOException e) {
                if (!isConnectFailure(e)) {
                    throw translate(backendName, url, timeoutClass, e);
                }
                breaker.recordFailure();
                metrics.incrementBackendRequest(backendName, "connect_error");
                lastFailure = new BackendUnavailableException(backendName, describe(e), e);

                if (attempt < attempts) {
                    Duration delay = retryPolicy.delayAfter(attempt - 1);
                    log.warn("Backend connect failure, retrying: backend={}, url={}, attempt={}, maxAttempts={}, delayMs={}, error={}",
                            backendName, url, attempt, attempts, delay.toMillis(), describe(e));
                    metrics.incrementRetry(backendName);
                    pause(backendName, delay);
                } else {
                    log.error("Backend unreachable after retries: backend={}, url={}, attempts={}, error={}",
                            backendName, url, attempts, describe(e));
                }

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackendException(backendName, "Interrupted while calling backend", e);
            }
        }

        throw lastFailure;
    }

    /**
     * Opens a streaming request. A single attempt is made; the caller owns the returned
     * stream and must close it.
     */
    public BackendStream stream(
            String backendName,
            String method,
            String url,
            TimeoutClass timeoutClass,
            byte[] body,
            Map<String, String> headers
    ) {
        CircuitBreaker breaker = getOrCreateCircuitBreaker(backendName);
        checkCircuit(backendName, breaker);
        HttpRequest httpRequest = buildRequest(backendName, method, url, timeoutClass, body, headers);
        Instant start = Instant.now();

        try {
            HttpResponse<InputStream> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
            breaker.recordSuccess();
            metrics.incrementBackendRequest(backendName, "success");
            metrics.recordBackendLatency(backendName, Duration.between(start, Instant.now()));
            log.debug("Backend stream opened: backend={}, url={}, status={}", backendName, url, response.statusCode());
            return new BackendStream(backendName, response.statusCode(), response.headers().map(), response.body());

        } catch (IOException e) {
            if (isConnectFailure(e)) {
                breaker.recordFailure();
                metrics.incrementBackendRequest(backendName, "connect_error");
                log.error("Backend stream connect failure: backend={}, url={}, error={}", backendName, url, describe(e));
                throw new BackendUnavailableException(backendName, describe(e), e);
            }
            throw translate(backendName, url, timeoutClass, e);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(backendName, "Interrupted while opening stream", e);
        }
    }

    /**
     * Performs a single health probe. The returned future never completes exceptionally.
     */
    public CompletableFuture<HealthResult> healthCheck(String backendName, String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(healthCheckTimeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            log.warn("Health check skipped, invalid url: backend={}, url={}", backendName, url);
            return CompletableFuture.completedFuture(HealthResult.unreachable("Invalid URL: " + url));
        }

        log.debug("Health check started: backend={}, url={}", backendName, url);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    if (response.statusCode() == 200) {
                        return HealthResult.healthy(response.statusCode());
                    }
                    log.warn("Health check failed: backend={}, status={}", backendName, response.statusCode());
                    return HealthResult.unhealthy(response.statusCode());
                })
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    log.warn("Health check error: backend={}, error={}", backendName, describe(cause));
                    return HealthResult.unreachable(describe(cause));
                });
    }

    private void checkCircuit(String backendName, CircuitBreaker breaker) {
        if (!breaker.allowRequest()) {
            metrics.incrementBackendRequest(backendName, "circuit_open");
            log.warn("Request blocked by circuit breaker: backend={}, failures={}",
                    backendName, breaker.getFailureCount());
            throw BackendUnavailableException.circuitOpen(backendName);
        }
    }

    private HttpRequest buildRequest(
            String backendName,
            String method,
            String url,
            TimeoutClass timeoutClass,
            byte[] body,
            Map<String, String> headers
    ) {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder().uri(URI.create(url));
        } catch (IllegalArgumentException e) {
            throw new BackendException(backendName, "Invalid backend URL: " + url, e);
        }

        HttpRequest.BodyPublisher publisher = body == null || body.length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);

        builder.timeout(timeoutFor(timeoutClass))
                .method(method.toUpperCase(Locale.ROOT), publisher);

        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null && !RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    builder.header(name, value);
                }
            });
        }
        return builder.build();
    }

    private BackendException translate(String backendName, String url, TimeoutClass timeoutClass, IOException e) {
        if (e instanceof HttpTimeoutException) {
            metrics.incrementBackendRequest(backendName, "timeout");
            log.error("Backend timeout: backend={}, url={}, timeoutClass={}, timeoutMs={}",
                    backendName, url, timeoutClass, timeoutFor(timeoutClass).toMillis());
            return new BackendTimeoutException(backendName,
                    "No answer within " + timeoutFor(timeoutClass).toSeconds() + "s", e);
        }
        metrics.incrementBackendRequest(backendName, "error");
        log.error("Backend I/O error: backend={}, url={}, errorType={}, error={}",
                backendName, url, e.getClass().getSimpleName(), e.getMessage());
        return new BackendException(backendName, describe(e), e);
    }

    static boolean isConnectFailure(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ConnectException || current instanceof HttpConnectTimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private void pause(String backendName, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(backendName, "Interrupted during retry backoff", e);
        }
    }

    public Duration timeoutFor(TimeoutClass timeoutClass) {
        return timeouts.get(timeoutClass != null ? timeoutClass : TimeoutClass.DEFAULT);
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private CircuitBreaker getOrCreateCircuitBreaker(String backendName) {
        return circuitBreakers.computeIfAbsent(backendName, name ->
                new CircuitBreaker(name, failureThreshold, cooldown));
    }

    /**
     * Gets the circuit breaker for a backend, or null if it was never called.
     */
    public CircuitBreaker getCircuitBreaker(String backendName) {
        return circuitBreakers.get(backendName);
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21; idle connections expire on their own
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private final Map<TimeoutClass, Duration> timeouts = new EnumMap<>(TimeoutClass.class);
        private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(30);
        private Duration healthCheckTimeout = Duration.ofSeconds(5);
        private Sleeper sleeper = Sleeper.THREAD;
        private MetricsRegistry metrics;

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder timeout(TimeoutClass timeoutClass, Duration duration) {
            this.timeouts.put(timeoutClass, duration);
            return this;
        }

        public Builder timeouts(Map<TimeoutClass, Duration> timeouts) {
            this.timeouts.putAll(timeouts);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder circuitBreaker(int failureThreshold, Duration cooldown) {
            this.failureThreshold = failureThreshold;
            this.cooldown = cooldown;
            return this;
        }

        public Builder healthCheckTimeout(Duration healthCheckTimeout) {
            this.healthCheckTimeout = healthCheckTimeout;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public BackendClient build() {
            return new BackendClient(this);
        }
    }
}
