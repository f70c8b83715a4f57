package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.synapse.gateway.GatewayFactory;
import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.synapse.gateway.infrastructure.health.GatewayHealth;
import fr.lapetina.synapse.gateway.infrastructure.health.HealthAggregator;
import fr.lapetina.synapse.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Public HTTP surface of the gateway, on the JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /health - aggregated backend health, always 200
 * - POST /v1/chat/completions - chat with model selection and profile defaults
 * - POST /v1/embeddings - embeddings passthrough
 * - GET /v1/models - OpenAI-style model list
 * - /models/** - model registry and profiles
 * - GET /events/terminal - terminal feed over Server-Sent Events
 * - GET /metrics - Prometheus metrics endpoint
 * - configured route prefixes (/tts, /stt, /speakers, /audio) - backend passthrough
 */
public final class GatewayHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor;

    public GatewayHttpServer(GatewayFactory context) throws IOException {
        GatewayConfig config = context.getConfig();
        GatewayConfig.ServerConfig serverConfig = config.getServer();
        ObjectMapper mapper = context.getObjectMapper();
        String router = config.getLlm().getBackend();

        InetSocketAddress address = serverConfig.getHost() == null || serverConfig.getHost().isBlank()
                ? new InetSocketAddress(serverConfig.getPort())
                : new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort());
        this.server = HttpServer.create(address, serverConfig.getBacklog());

        // Streams hold their thread for the whole response, so the pool must grow on demand
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("gateway-http"));
        server.setExecutor(executor);

        server.createContext("/health", new HealthHandler(mapper, context.getHealthAggregator()));
        if (config.getMetrics().isEnabled()) {
            server.createContext("/metrics", new MetricsHandler(mapper, context.getMetricsRegistry()));
        }
        server.createContext(ChatCompletionsHandler.PATH, new ChatCompletionsHandler(
                mapper, context.getBackendRegistry(), context.getBackendClient(), context.getChatPreparer(), router));
        server.createContext(EmbeddingsHandler.PATH, new EmbeddingsHandler(
                mapper, context.getBackendRegistry(), context.getBackendClient(), config.getLlm().getEmbeddingsBackend()));
        server.createContext(OpenAiModelsHandler.PATH, new OpenAiModelsHandler(
                mapper, context.getBackendRegistry(), context.getBackendClient(), context.getModelRegistryClient(),
                router, config.getLlm().getEmbeddingsBackend()));
        server.createContext(ModelsHandler.PATH, new ModelsHandler(
                mapper, context.getBackendRegistry(), context.getBackendClient(), context.getModelRegistryClient(),
                context.getOrchestrator(), context.getProfileStore(), router));
        server.createContext(TerminalEventsHandler.PATH, new TerminalEventsHandler(
                mapper, context.getTerminalFeed(), config.getTerminalFeed(), context.getBusMode()));

        for (GatewayConfig.RouteConfig route : config.getRoutes()) {
            server.createContext(route.getPrefix(), new PassthroughHandler(
                    mapper,
                    route.getPrefix(),
                    route.getBackend(),
                    TimeoutClass.fromName(route.getTimeoutClass()),
                    context.getBackendRegistry(),
                    context.getBackendClient()
            ));
            log.debug("Route registered: prefix={}, backend={}, timeoutClass={}",
                    route.getPrefix(), route.getBackend(), route.getTimeoutClass());
        }

        log.info("HTTP server configured: port={}, routes={}", serverConfig.getPort(), config.getRoutes().size());
    }

    public void start() {
        server.start();
        log.info("HTTP server started: port={}", getPort());
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== HEALTH HANDLER ====================

    private static final class HealthHandler extends GatewayHandler {
        private final HealthAggregator aggregator;

        HealthHandler(ObjectMapper mapper, HealthAggregator aggregator) {
            super(mapper);
            this.aggregator = aggregator;
        }

        @Override
        protected void doHandle(HttpExchange exchange) throws Exception {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            GatewayHealth health = aggregator.checkAll().join();
            HttpExchanges.sendJson(exchange, objectMapper, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private static final class MetricsHandler extends GatewayHandler {
        private final MetricsRegistry metricsRegistry;

        MetricsHandler(ObjectMapper mapper, MetricsRegistry metricsRegistry) {
            super(mapper);
            this.metricsRegistry = metricsRegistry;
        }

        @Override
        protected void doHandle(HttpExchange exchange) throws Exception {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            byte[] bytes = metricsRegistry.scrape().getBytes(StandardCharsets.UTF_8);
            HttpExchanges.sendBytes(exchange, 200, "text/plain; version=0.0.4", bytes);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
