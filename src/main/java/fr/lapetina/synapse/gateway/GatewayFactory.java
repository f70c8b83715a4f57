package fr.lapetina.synapse.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.strategy.KeywordModelSelector;
import fr.lapetina.synapse.gateway.domain.strategy.ModelSelectionStrategy;
import fr.lapetina.synapse.gateway.feed.LogRedactor;
import fr.lapetina.synapse.gateway.feed.TerminalFeed;
import fr.lapetina.synapse.gateway.feed.TerminalFeedAppender;
import fr.lapetina.synapse.gateway.feed.bus.RedisTerminalFeedBus;
import fr.lapetina.synapse.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.synapse.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.synapse.gateway.infrastructure.health.BackendRegistry;
import fr.lapetina.synapse.gateway.infrastructure.health.HealthAggregator;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.RetryPolicy;
import fr.lapetina.synapse.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.synapse.gateway.infrastructure.profile.ModelProfileStore;
import fr.lapetina.synapse.gateway.orchestration.ChatCompletionPreparer;
import fr.lapetina.synapse.gateway.orchestration.ModelLoadOrchestrator;
import fr.lapetina.synapse.gateway.orchestration.ModelRegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds and owns every gateway component from configuration. This is the one
 * place where collaborators are wired together; nothing else holds global state.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("gateway.yaml").start()) {
 *     BackendClient client = factory.getBackendClient();
 *     // ...
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    public static final String BUS_LOCAL = "local";
    public static final String BUS_REDIS = "redis";

    private final ConfigLoader configLoader;
    private final GatewayConfig config;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final BackendRegistry backendRegistry;
    private final BackendClient backendClient;
    private final HealthAggregator healthAggregator;
    private final ModelProfileStore profileStore;
    private final ModelRegistryClient modelRegistryClient;
    private final ModelLoadOrchestrator orchestrator;
    private final ChatCompletionPreparer chatPreparer;
    private final TerminalFeed terminalFeed;
    private final RedisTerminalFeedBus feedBus;
    private final String busMode;

    protected GatewayFactory(ConfigLoader configLoader, GatewayConfig config) {
        this.configLoader = configLoader;
        this.config = config;

        this.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        this.metricsRegistry = new MetricsRegistry(
                config.getMetrics().getPrefix(), config.getMetrics().isJvmMetrics());

        this.backendRegistry = new BackendRegistry();
        backendRegistry.replaceAll(toBackends(config));

        this.backendClient = createBackendClient(config);
        this.healthAggregator = new HealthAggregator(
                backendRegistry,
                backendClient,
                metricsRegistry,
                Duration.ofMillis(config.getHttp().getHealthCheckIntervalMs())
        );

        this.profileStore = new ModelProfileStore(Paths.get(config.getProfiles().getPath()), objectMapper);
        this.modelRegistryClient = new ModelRegistryClient(backendClient, objectMapper);
        GatewayConfig.LlmConfig llm = config.getLlm();
        this.orchestrator = new ModelLoadOrchestrator(
                modelRegistryClient,
                metricsRegistry,
                Duration.ofMillis(llm.getLoadPollIntervalMs()),
                Duration.ofMillis(llm.getLoadTimeoutMs()),
                llm.isSerializeModelLoads()
        );
        ModelSelectionStrategy selector = new KeywordModelSelector(
                llm.getGeneralModel(), llm.getCoderModel(), llm.getAutoAliases());
        this.chatPreparer = new ChatCompletionPreparer(selector, orchestrator, profileStore);

        GatewayConfig.TerminalFeedConfig feedConfig = config.getTerminalFeed();
        this.terminalFeed = feedConfig.isLive() ? createTerminalFeed(feedConfig) : null;
        this.busMode = resolveBusMode(feedConfig.getBus().getMode());
        this.feedBus = terminalFeed != null && BUS_REDIS.equals(busMode)
                ? new RedisTerminalFeedBus(
                        terminalFeed,
                        objectMapper,
                        feedConfig.getBus().getRedisUrl(),
                        feedConfig.getBus().getChannel(),
                        feedConfig.getBus().getConnectTimeoutMs())
                : null;

        configLoader.addListener(this::onConfigChanged);

        log.info("GatewayFactory initialized: backends={}, feedMode={}, busMode={}",
                backendRegistry.size(), feedConfig.getMode(), busMode);
    }

    /**
     * Creates a factory from the specified configuration file or classpath resource.
     */
    public static GatewayFactory create(String configPath) {
        log.info("Initializing GatewayFactory from config: path={}", configPath);
        ConfigLoader loader = new ConfigLoader(configPath);
        return new GatewayFactory(loader, loader.load());
    }

    /**
     * Starts the terminal feed, its bus, log capture, health refresh and config watching.
     */
    public GatewayFactory start() {
        if (terminalFeed != null) {
            terminalFeed.start();
            if (config.getTerminalFeed().isCaptureLogs()) {
                TerminalFeedAppender.attach(terminalFeed);
            }
            if (feedBus != null) {
                feedBus.start();
            }
        }
        healthAggregator.start();
        configLoader.startWatching();
        log.info("Gateway components started");
        return this;
    }

    public GatewayConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public BackendRegistry getBackendRegistry() {
        return backendRegistry;
    }

    public BackendClient getBackendClient() {
        return backendClient;
    }

    public HealthAggregator getHealthAggregator() {
        return healthAggregator;
    }

    public ModelProfileStore getProfileStore() {
        return profileStore;
    }

    public ModelRegistryClient getModelRegistryClient() {
        return modelRegistryClient;
    }

    public ModelLoadOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ChatCompletionPreparer getChatPreparer() {
        return chatPreparer;
    }

    /**
     * @return the feed, or null when the feed mode is not {@code live}
     */
    public TerminalFeed getTerminalFeed() {
        return terminalFeed;
    }

    public String getBusMode() {
        return busMode;
    }

    protected BackendClient createBackendClient(GatewayConfig config) {
        GatewayConfig.HttpConfig http = config.getHttp();
        // The JDK client reads its pool settings from system properties when the first client is built
        System.setProperty("jdk.httpclient.connectionPoolSize", String.valueOf(http.getPoolSize()));
        System.setProperty("jdk.httpclient.keepalive.timeout", String.valueOf(http.getKeepAliveSeconds()));

        GatewayConfig.RetryConfig retry = config.getRetry();
        return BackendClient.builder()
                .connectTimeout(Duration.ofMillis(http.getConnectTimeoutMs()))
                .timeouts(config.getTimeouts().toDurations())
                .retryPolicy(new RetryPolicy(
                        retry.getMaxRetries(),
                        Duration.ofMillis(retry.getInitialBackoffMs()),
                        Duration.ofMillis(retry.getMaxBackoffMs()),
                        retry.getBackoffMultiplier()))
                .circuitBreaker(
                        config.getCircuitBreaker().getFailureThreshold(),
                        Duration.ofMillis(config.getCircuitBreaker().getCooldownMs()))
                .healthCheckTimeout(Duration.ofMillis(http.getHealthCheckTimeoutMs()))
                .metrics(metricsRegistry)
                .build();
    }

    private TerminalFeed createTerminalFeed(GatewayConfig.TerminalFeedConfig feedConfig) {
        return TerminalFeed.builder()
                .bufferSize(feedConfig.getBufferSize())
                .subscriberQueueSize(feedConfig.getSubscriberQueueSize())
                .maxLineChars(feedConfig.getMaxLineChars())
                .ringBufferSize(feedConfig.getRingBufferSize())
                .waitStrategy(feedConfig.getWaitStrategy())
                .instanceId(resolveInstanceId(feedConfig.getInstanceId()))
                .redactor(new LogRedactor(feedConfig.getRedactExtraPatterns()))
                .metrics(metricsRegistry)
                .build();
    }

    static String resolveInstanceId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String hostname = System.getenv("HOSTNAME");
        if (hostname != null && !hostname.isBlank()) {
            return hostname.trim();
        }
        return "gateway-" + UUID.randomUUID().toString().substring(0, 8);
    }

    static String resolveBusMode(String configured) {
        String mode = configured == null ? BUS_LOCAL : configured.trim().toLowerCase(Locale.ROOT);
        if (mode.isEmpty() || BUS_LOCAL.equals(mode)) {
            return BUS_LOCAL;
        }
        if (BUS_REDIS.equals(mode)) {
            return BUS_REDIS;
        }
        log.warn("Unknown terminal feed bus mode, using local: mode={}", configured);
        return BUS_LOCAL;
    }

    private static List<Backend> toBackends(GatewayConfig config) {
        return config.getBackends().stream()
                .map(b -> new Backend(b.getName(), b.getUrl(), b.getHealth()))
                .collect(Collectors.toList());
    }

    private void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
        log.info("Configuration changed, re-registering backends...");
        backendRegistry.replaceAll(toBackends(newConfig));
        log.info("Backend registry updated: backends={}", backendRegistry.size());
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            healthAggregator.close();
        } catch (Exception e) {
            log.warn("Error closing health aggregator", e);
        }

        if (feedBus != null) {
            try {
                feedBus.close();
            } catch (Exception e) {
                log.warn("Error closing terminal feed bus", e);
            }
        }

        if (terminalFeed != null) {
            TerminalFeedAppender.detach();
            try {
                terminalFeed.close();
            } catch (Exception e) {
                log.warn("Error closing terminal feed", e);
            }
        }

        try {
            backendClient.close();
        } catch (Exception e) {
            log.warn("Error closing backend client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("GatewayFactory shut down");
    }
}
