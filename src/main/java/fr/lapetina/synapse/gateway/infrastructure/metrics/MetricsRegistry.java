package fr.lapetina.synapse.gateway.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Backend call counters by outcome, retry and circuit rejection counters
 * - Backend latency timers
 * - Model load outcome counters and load latency
 * - Gauges for the terminal feed and backend health
 * - JVM metrics and Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> backendCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> backendTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> modelLoadCounters = new ConcurrentHashMap<>();
    private final Timer modelLoadTimer;

    public MetricsRegistry(String prefix, boolean jvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (jvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        this.modelLoadTimer = Timer.builder(prefix + "_model_load_latency")
                .description("Time spent bringing a model to the loaded state")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized: prefix={}, jvmMetrics={}", prefix, jvmMetrics);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("synapse_gateway");
    }

    /**
     * Counts one backend call attempt by its outcome
     * ({@code success}, {@code connect_error}, {@code timeout}, {@code error}, {@code circuit_open}).
     */
    public void incrementBackendRequest(String backend, String outcome) {
        String key = backend + ":" + outcome;
        backendCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_backend_requests_total")
                        .description("Backend call attempts by outcome")
                        .tag("backend", backend)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void incrementRetry(String backend) {
        retryCounters.computeIfAbsent(backend, k ->
                Counter.builder(prefix + "_backend_retries_total")
                        .description("Retries after connect-class failures")
                        .tag("backend", backend)
                        .register(registry)
        ).increment();
    }

    public void recordBackendLatency(String backend, Duration latency) {
        backendTimers.computeIfAbsent(backend, k ->
                Timer.builder(prefix + "_backend_latency")
                        .description("Backend response latency up to headers")
                        .tag("backend", backend)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementModelLoad(String outcome) {
        modelLoadCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_model_loads_total")
                        .description("Model load attempts by outcome")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordModelLoadLatency(Duration latency) {
        modelLoadTimer.record(latency);
    }

    /**
     * Registers a gauge whose value is read from the supplier at scrape time.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Registers a gauge for backend health (0=unreachable, 1=unhealthy, 2=healthy).
     */
    public void registerBackendHealth(String backend, Supplier<Number> healthValue) {
        Gauge.builder(prefix + "_backend_health", healthValue, s -> s.get().doubleValue())
                .description("Backend health (0=unreachable, 1=unhealthy, 2=healthy)")
                .tag("backend", backend)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
