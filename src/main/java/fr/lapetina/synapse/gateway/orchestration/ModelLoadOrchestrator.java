package fr.lapetina.synapse.gateway.orchestration;

import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.model.ModelLoadState;
import fr.lapetina.synapse.gateway.domain.model.ModelStatus;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendException;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendResponse;
import fr.lapetina.synapse.gateway.infrastructure.http.Sleeper;
import fr.lapetina.synapse.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Brings a model to the loaded state on the LLM router, evicting whatever else is loaded.
 *
 * Steps for one call: list the registry, unload every other loaded model one by one,
 * issue a load unless the target is already loaded or loading, then poll the registry
 * until the target is loaded, reports a failed load, or the deadline passes.
 *
 * The router holds a single large model at a time, so concurrent calls for different
 * models would evict each other. When {@code serializeLoads} is on, calls for the same
 * router are queued behind a fair lock.
 */
public class ModelLoadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ModelLoadOrchestrator.class);

    private final ModelRegistryClient registry;
    private final MetricsRegistry metrics;
    private final Duration pollInterval;
    private final Duration loadTimeout;
    private final boolean serializeLoads;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Map<String, ReentrantLock> loadLocks = new ConcurrentHashMap<>();

    public ModelLoadOrchestrator(
            ModelRegistryClient registry,
            MetricsRegistry metrics,
            Duration pollInterval,
            Duration loadTimeout,
            boolean serializeLoads,
            Sleeper sleeper,
            Clock clock
    ) {
        this.registry = registry;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
        this.loadTimeout = loadTimeout;
        this.serializeLoads = serializeLoads;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public ModelLoadOrchestrator(ModelRegistryClient registry, MetricsRegistry metrics,
                                 Duration pollInterval, Duration loadTimeout, boolean serializeLoads) {
        this(registry, metrics, pollInterval, loadTimeout, serializeLoads, Sleeper.THREAD, Clock.systemUTC());
    }

    /**
     * Returns once the model is loaded on the backend.
     *
     * @throws ModelLoadException UNKNOWN_MODEL, LOAD_REJECTED, LOAD_FAILED, TIMED_OUT or REGISTRY_UNAVAILABLE
     * @throws BackendException   the router could not be reached at all
     */
    public void ensureModelLoaded(Backend backend, String modelId) {
        ReentrantLock lock = serializeLoads
                ? loadLocks.computeIfAbsent(backend.baseUrl(), k -> new ReentrantLock(true))
                : null;
        if (lock != null) {
            lock.lock();
        }
        Instant start = clock.instant();
        try {
            doEnsureLoaded(backend, modelId, start);
        } finally {
            if (lock != null) {
                lock.unlock();
            }
        }
    }

    private void doEnsureLoaded(Backend backend, String modelId, Instant start) {
        List<ModelLoadState> states = registry.listModels(backend);
        List<ModelView> views = SplitModelCollapser.collapse(states);
        ModelView target = SplitModelCollapser.find(views, modelId).orElse(null);
        if (target == null) {
            metrics.incrementModelLoad("unknown_model");
            log.warn("Model not known to router: backend={}, model={}", backend.name(), modelId);
            throw new ModelLoadException(ModelLoadException.Reason.UNKNOWN_MODEL, modelId,
                    "Model '" + modelId + "' is not available on " + backend.name());
        }

        unloadOthers(backend, states, target);

        if (target.status() == ModelStatus.LOADED) {
            metrics.incrementModelLoad("already_loaded");
            log.debug("Model already loaded: backend={}, model={}", backend.name(), target.id());
            return;
        }

        if (target.status() != ModelStatus.LOADING) {
            BackendResponse response = registry.load(backend, target.id());
            if (response.statusCode() != 200) {
                metrics.incrementModelLoad("rejected");
                log.error("Model load rejected: backend={}, model={}, status={}",
                        backend.name(), target.id(), response.statusCode());
                throw new ModelLoadException(ModelLoadException.Reason.LOAD_REJECTED, target.id(),
                        "Router rejected load of '" + target.id() + "' with HTTP " + response.statusCode(),
                        response.statusCode());
            }
        } else {
            log.info("Model already loading, waiting: backend={}, model={}", backend.name(), target.id());
        }

        LoadOutcome outcome = awaitLoaded(backend, target.id(), loadTimeout);
        Duration elapsed = Duration.between(start, clock.instant());
        metrics.recordModelLoadLatency(elapsed);

        switch (outcome) {
            case LOADED:
                metrics.incrementModelLoad("loaded");
                log.info("Model loaded: backend={}, model={}, elapsedMs={}", backend.name(), target.id(), elapsed.toMillis());
                return;
            case FAILED:
                metrics.incrementModelLoad("failed");
                log.error("Model load failed: backend={}, model={}, elapsedMs={}", backend.name(), target.id(), elapsed.toMillis());
                throw new ModelLoadException(ModelLoadException.Reason.LOAD_FAILED, target.id(),
                        "Router reported a failed load for '" + target.id() + "'");
            case TIMED_OUT:
            default:
                metrics.incrementModelLoad("timed_out");
                log.error("Model load timed out: backend={}, model={}, timeoutMs={}", backend.name(), target.id(), loadTimeout.toMillis());
                throw new ModelLoadException(ModelLoadException.Reason.TIMED_OUT, target.id(),
                        "Model '" + target.id() + "' not loaded after " + loadTimeout.toSeconds() + "s");
        }
    }

    /**
     * Unloads every loaded entry outside the target's group. Failures are logged and ignored.
     */
    private void unloadOthers(Backend backend, List<ModelLoadState> states, ModelView target) {
        for (ModelLoadState state : states) {
            if (state.status() != ModelStatus.LOADED || target.contains(state.id())) {
                continue;
            }
            try {
                BackendResponse response = registry.unload(backend, state.id());
                if (!response.isSuccess()) {
                    log.warn("Unload refused: backend={}, model={}, status={}", backend.name(), state.id(), response.statusCode());
                }
            } catch (BackendException e) {
                log.warn("Unload failed: backend={}, model={}, error={}", backend.name(), state.id(), e.getMessage());
            }
        }
    }

    /**
     * Polls the registry until the model is loaded, reports a failure, or the timeout elapses.
     */
    public LoadOutcome awaitLoaded(Backend backend, String modelId, Duration timeout) {
        Instant deadline = clock.instant().plus(timeout);
        int polls = 0;

        while (true) {
            polls++;
            Optional<ModelView> view = poll(backend, modelId);
            if (view.isPresent()) {
                if (view.get().status() == ModelStatus.LOADED) {
                    log.debug("Load poll finished: backend={}, model={}, polls={}", backend.name(), modelId, polls);
                    return LoadOutcome.LOADED;
                }
                if (view.get().failed()) {
                    return LoadOutcome.FAILED;
                }
            }

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return LoadOutcome.TIMED_OUT;
            }
            try {
                sleeper.sleep(remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackendException(backend.name(), "Interrupted while waiting for model load", e);
            }
        }
    }

    private Optional<ModelView> poll(Backend backend, String modelId) {
        try {
            return SplitModelCollapser.find(registry.listLogicalModels(backend), modelId);
        } catch (ModelLoadException | BackendException e) {
            // A poll that cannot read the registry is not an outcome; only the deadline ends the wait
            log.warn("Load poll failed, will retry: backend={}, model={}, error={}", backend.name(), modelId, e.getMessage());
            return Optional.empty();
        }
    }
}
