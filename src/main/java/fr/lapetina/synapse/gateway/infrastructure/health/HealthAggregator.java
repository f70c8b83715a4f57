package fr.lapetina.synapse.gateway.infrastructure.health;

import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.HealthResult;
import fr.lapetina.synapse.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Probes every registered backend concurrently and folds the results into one
 * {@link GatewayHealth}. A failing probe only degrades its own entry.
 *
 * Optionally refreshes in the background so health gauges stay current between
 * calls to the health endpoint.
 */
public final class HealthAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    private final BackendRegistry registry;
    private final BackendClient client;
    private final MetricsRegistry metrics;
    private final Duration refreshInterval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<String> gaugedBackends = ConcurrentHashMap.newKeySet();

    public HealthAggregator(BackendRegistry registry, BackendClient client, MetricsRegistry metrics,
                            Duration refreshInterval) {
        this.registry = registry;
        this.client = client;
        this.metrics = metrics;
        this.refreshInterval = refreshInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic refresh. A zero or negative interval disables it.
     */
    public void start() {
        if (refreshInterval.isZero() || refreshInterval.isNegative()) {
            log.info("Background health refresh disabled");
            return;
        }
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(this::refresh, 0, refreshInterval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Health checker started: intervalMs={}", refreshInterval.toMillis());
        }
    }

    private void refresh() {
        try {
            checkAll().join();
        } catch (Exception e) {
            log.error("Background health refresh failed", e);
        }
    }

    /**
     * Probes all backends in parallel. Never completes exceptionally.
     */
    public CompletableFuture<GatewayHealth> checkAll() {
        List<Backend> backends = registry.getAll();
        Map<String, CompletableFuture<HealthResult>> probes = new LinkedHashMap<>();
        for (Backend backend : backends) {
            probes.put(backend.name(), client.healthCheck(backend.name(), backend.healthUrl()));
        }

        return CompletableFuture.allOf(probes.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<String, HealthResult> results = new LinkedHashMap<>();
                    probes.forEach((name, probe) -> {
                        HealthResult result = probe.join();
                        results.put(name, result);
                        record(name, result);
                    });
                    GatewayHealth health = GatewayHealth.of(results);
                    log.debug("Health aggregated: status={}, backends={}", health.status(), results.size());
                    return health;
                });
    }

    private void record(String name, HealthResult result) {
        registry.updateHealth(name, result);
        if (gaugedBackends.add(name)) {
            metrics.registerBackendHealth(name, () -> registry.getLastHealth(name)
                    .map(r -> r.status().getGaugeValue())
                    .orElse(0));
        }
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health checker stopped");
    }
}
