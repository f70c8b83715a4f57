package fr.lapetina.synapse.gateway.infrastructure.config;

import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML.
 */
public class GatewayConfig {

    private ServerConfig server = new ServerConfig();
    private List<BackendConfig> backends = new ArrayList<>();
    private List<RouteConfig> routes = new ArrayList<>();
    private HttpConfig http = new HttpConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private RetryConfig retry = new RetryConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private LlmConfig llm = new LlmConfig();
    private ProfilesConfig profiles = new ProfilesConfig();
    private TerminalFeedConfig terminalFeed = new TerminalFeedConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<BackendConfig> getBackends() { return backends; }
    public void setBackends(List<BackendConfig> backends) { this.backends = backends; }

    public List<RouteConfig> getRoutes() { return routes; }
    public void setRoutes(List<RouteConfig> routes) { this.routes = routes; }

    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public LlmConfig getLlm() { return llm; }
    public void setLlm(LlmConfig llm) { this.llm = llm; }

    public ProfilesConfig getProfiles() { return profiles; }
    public void setProfiles(ProfilesConfig profiles) { this.profiles = profiles; }

    public TerminalFeedConfig getTerminalFeed() { return terminalFeed; }
    public void setTerminalFeed(TerminalFeedConfig terminalFeed) { this.terminalFeed = terminalFeed; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public Optional<BackendConfig> findBackend(String name) {
        return backends.stream().filter(b -> b.getName() != null && b.getName().equals(name)).findFirst();
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * One downstream service. {@code health} is the probe path appended to the url.
     */
    public static class BackendConfig {
        private String name;
        private String url;
        private String health = "/health";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getHealth() { return health; }
        public void setHealth(String health) { this.health = health; }
    }

    /**
     * Path prefix forwarded verbatim to a backend, e.g. {@code /tts -> tts}.
     */
    public static class RouteConfig {
        private String prefix;
        private String backend;
        private String timeoutClass = "default";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }

        public String getTimeoutClass() { return timeoutClass; }
        public void setTimeoutClass(String timeoutClass) { this.timeoutClass = timeoutClass; }
    }

    /**
     * Outbound HTTP client configuration.
     */
    public static class HttpConfig {
        private long connectTimeoutMs = 10000;
        private int poolSize = 100;
        private int keepAliveSeconds = 30;
        private long healthCheckTimeoutMs = 5000;
        private long healthCheckIntervalMs = 30000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public int getKeepAliveSeconds() { return keepAliveSeconds; }
        public void setKeepAliveSeconds(int keepAliveSeconds) { this.keepAliveSeconds = keepAliveSeconds; }

        public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
        public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }

        public long getHealthCheckIntervalMs() { return healthCheckIntervalMs; }
        public void setHealthCheckIntervalMs(long healthCheckIntervalMs) { this.healthCheckIntervalMs = healthCheckIntervalMs; }
    }

    /**
     * Duration of each timeout class.
     */
    public static class TimeoutsConfig {
        private long llmMs = 300000;
        private long embeddingsMs = 60000;
        private long ttsMs = 120000;
        private long sttMs = 600000;
        private long speakerMs = 600000;
        private long audioMs = 600000;
        private long defaultMs = 60000;

        public long getLlmMs() { return llmMs; }
        public void setLlmMs(long llmMs) { this.llmMs = llmMs; }

        public long getEmbeddingsMs() { return embeddingsMs; }
        public void setEmbeddingsMs(long embeddingsMs) { this.embeddingsMs = embeddingsMs; }

        public long getTtsMs() { return ttsMs; }
        public void setTtsMs(long ttsMs) { this.ttsMs = ttsMs; }

        public long getSttMs() { return sttMs; }
        public void setSttMs(long sttMs) { this.sttMs = sttMs; }

        public long getSpeakerMs() { return speakerMs; }
        public void setSpeakerMs(long speakerMs) { this.speakerMs = speakerMs; }

        public long getAudioMs() { return audioMs; }
        public void setAudioMs(long audioMs) { this.audioMs = audioMs; }

        public long getDefaultMs() { return defaultMs; }
        public void setDefaultMs(long defaultMs) { this.defaultMs = defaultMs; }

        public Map<TimeoutClass, Duration> toDurations() {
            Map<TimeoutClass, Duration> durations = new EnumMap<>(TimeoutClass.class);
            durations.put(TimeoutClass.LLM, Duration.ofMillis(llmMs));
            durations.put(TimeoutClass.EMBEDDINGS, Duration.ofMillis(embeddingsMs));
            durations.put(TimeoutClass.TTS, Duration.ofMillis(ttsMs));
            durations.put(TimeoutClass.STT, Duration.ofMillis(sttMs));
            durations.put(TimeoutClass.SPEAKER, Duration.ofMillis(speakerMs));
            durations.put(TimeoutClass.AUDIO, Duration.ofMillis(audioMs));
            durations.put(TimeoutClass.DEFAULT, Duration.ofMillis(defaultMs));
            return durations;
        }
    }

    /**
     * Retry configuration. {@code maxRetries} is the total number of attempts.
     */
    public static class RetryConfig {
        private int maxRetries = 3;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 2000;
        private double backoffMultiplier = 2.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Circuit breaker configuration, shared by every backend.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long cooldownMs = 30000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }
    }

    /**
     * LLM routing and model lifecycle configuration.
     */
    public static class LlmConfig {
        private String backend = "llama-router";
        private String embeddingsBackend = "llama-embed";
        private String generalModel;
        private String coderModel;
        private Set<String> autoAliases = new LinkedHashSet<>(List.of("auto", "default"));
        private long loadPollIntervalMs = 1000;
        private long loadTimeoutMs = 240000;
        private boolean serializeModelLoads = true;

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }

        public String getEmbeddingsBackend() { return embeddingsBackend; }
        public void setEmbeddingsBackend(String embeddingsBackend) { this.embeddingsBackend = embeddingsBackend; }

        public String getGeneralModel() { return generalModel; }
        public void setGeneralModel(String generalModel) { this.generalModel = generalModel; }

        public String getCoderModel() { return coderModel; }
        public void setCoderModel(String coderModel) { this.coderModel = coderModel; }

        public Set<String> getAutoAliases() { return autoAliases; }
        public void setAutoAliases(Set<String> autoAliases) { this.autoAliases = autoAliases; }

        public long getLoadPollIntervalMs() { return loadPollIntervalMs; }
        public void setLoadPollIntervalMs(long loadPollIntervalMs) { this.loadPollIntervalMs = loadPollIntervalMs; }

        public long getLoadTimeoutMs() { return loadTimeoutMs; }
        public void setLoadTimeoutMs(long loadTimeoutMs) { this.loadTimeoutMs = loadTimeoutMs; }

        public boolean isSerializeModelLoads() { return serializeModelLoads; }
        public void setSerializeModelLoads(boolean serializeModelLoads) { this.serializeModelLoads = serializeModelLoads; }
    }

    /**
     * Model profile persistence.
     */
    public static class ProfilesConfig {
        private String path = "data/model_profiles.json";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    /**
     * Operator terminal feed configuration.
     */
    public static class TerminalFeedConfig {
        private String mode = "live";
        private int bufferSize = 2000;
        private int subscriberQueueSize = 500;
        private int maxLineChars = 4000;
        private String defaultLevel = "INFO";
        private int backlogLines = 200;
        private int keepaliveSeconds = 15;
        private String redactExtraPatterns = "";
        private String instanceId = "";
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private boolean captureLogs = true;
        private BusConfig bus = new BusConfig();

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }

        public int getSubscriberQueueSize() { return subscriberQueueSize; }
        public void setSubscriberQueueSize(int subscriberQueueSize) { this.subscriberQueueSize = subscriberQueueSize; }

        public int getMaxLineChars() { return maxLineChars; }
        public void setMaxLineChars(int maxLineChars) { this.maxLineChars = maxLineChars; }

        public String getDefaultLevel() { return defaultLevel; }
        public void setDefaultLevel(String defaultLevel) { this.defaultLevel = defaultLevel; }

        public int getBacklogLines() { return backlogLines; }
        public void setBacklogLines(int backlogLines) { this.backlogLines = backlogLines; }

        public int getKeepaliveSeconds() { return keepaliveSeconds; }
        public void setKeepaliveSeconds(int keepaliveSeconds) { this.keepaliveSeconds = keepaliveSeconds; }

        public String getRedactExtraPatterns() { return redactExtraPatterns; }
        public void setRedactExtraPatterns(String redactExtraPatterns) { this.redactExtraPatterns = redactExtraPatterns; }

        public String getInstanceId() { return instanceId; }
        public void setInstanceId(String instanceId) { this.instanceId = instanceId; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public boolean isCaptureLogs() { return captureLogs; }
        public void setCaptureLogs(boolean captureLogs) { this.captureLogs = captureLogs; }

        public BusConfig getBus() { return bus; }
        public void setBus(BusConfig bus) { this.bus = bus; }

        public boolean isLive() {
            return mode != null && mode.trim().equalsIgnoreCase("live");
        }
    }

    /**
     * Cross-replica relay of terminal feed events.
     */
    public static class BusConfig {
        private String mode = "local";
        private String redisUrl = "redis://localhost:6379/0";
        private String channel = "synapse:terminal_feed";
        private int connectTimeoutMs = 5000;

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public String getRedisUrl() { return redisUrl; }
        public void setRedisUrl(String redisUrl) { this.redisUrl = redisUrl; }

        public String getChannel() { return channel; }
        public void setChannel(String channel) { this.channel = channel; }

        public int getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "synapse_gateway";
        private boolean jvmMetrics = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public boolean isJvmMetrics() { return jvmMetrics; }
        public void setJvmMetrics(boolean jvmMetrics) { this.jvmMetrics = jvmMetrics; }
    }
}
