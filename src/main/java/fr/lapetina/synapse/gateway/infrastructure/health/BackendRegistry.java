package fr.lapetina.synapse.gateway.infrastructure.health;

import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.infrastructure.http.HealthResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of configured backends and their last observed health.
 *
 * Lookups are lock-free: the backend map is replaced as a whole on every change
 * and keeps configuration order. Supports reload and change notifications.
 */
public final class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private volatile Map<String, Backend> backends = Collections.emptyMap();
    private final Map<String, HealthResult> lastHealth = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new backend or updates an existing one.
     */
    public synchronized void register(Backend backend) {
        Map<String, Backend> next = new LinkedHashMap<>(backends);
        Backend previous = next.put(backend.name(), backend);
        backends = Collections.unmodifiableMap(next);
        if (previous == null) {
            log.info("Backend registered: name={}, url={}", backend.name(), backend.baseUrl());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.ADDED, backend));
        } else if (!previous.equals(backend)) {
            log.info("Backend updated: name={}, url={}", backend.name(), backend.baseUrl());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.UPDATED, backend));
        }
    }

    public synchronized Optional<Backend> remove(String name) {
        Map<String, Backend> next = new LinkedHashMap<>(backends);
        Backend removed = next.remove(name);
        if (removed != null) {
            backends = Collections.unmodifiableMap(next);
            lastHealth.remove(name);
            log.info("Backend removed: name={}", name);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.REMOVED, removed));
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Backend> get(String name) {
        return Optional.ofNullable(backends.get(name));
    }

    /**
     * @throws UnknownBackendException if no backend has that name
     */
    public Backend require(String name) {
        Backend backend = backends.get(name);
        if (backend == null) {
            throw new UnknownBackendException(name);
        }
        return backend;
    }

    public List<Backend> getAll() {
        return new ArrayList<>(backends.values());
    }

    /**
     * Replaces all backends with a new set. Used for configuration reload.
     */
    public synchronized void replaceAll(Collection<Backend> newBackends) {
        List<String> keep = new ArrayList<>();
        for (Backend backend : newBackends) {
            keep.add(backend.name());
            register(backend);
        }
        for (String existing : new ArrayList<>(backends.keySet())) {
            if (!keep.contains(existing)) {
                remove(existing);
            }
        }
        log.info("Backend registry replaced: backends={}", backends.size());
    }

    public void updateHealth(String name, HealthResult result) {
        if (!backends.containsKey(name)) {
            return;
        }
        HealthResult previous = lastHealth.put(name, result);
        if (previous == null || previous.status() != result.status()) {
            log.info("Backend health changed: name={}, previous={}, current={}",
                    name, previous != null ? previous.status() : "unknown", result.status());
        }
    }

    public Optional<HealthResult> getLastHealth(String name) {
        return Optional.ofNullable(lastHealth.get(name));
    }

    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener", e);
            }
        }
    }

    public int size() {
        return backends.size();
    }

    /**
     * Event for backend registry changes.
     */
    public record RegistryEvent(Type type, Backend backend) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED
        }
    }
}
