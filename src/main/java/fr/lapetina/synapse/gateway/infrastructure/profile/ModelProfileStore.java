package fr.lapetina.synapse.gateway.infrastructure.profile;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON-file backed store of per-model profiles.
 *
 * The whole store is one document {@code {"version": 1, "models": {id: {updated_at, values}}}}.
 * Every write serializes the full document to a temporary file next to the target and
 * renames it over the target, so readers of the file only ever see a complete document.
 * The in-memory copy is replaced only after the rename succeeded.
 *
 * The store does not know about schemas; callers validate values first.
 * Thread-safe: one lock guards both the in-memory document and the file.
 */
public final class ModelProfileStore {

    private static final Logger log = LoggerFactory.getLogger(ModelProfileStore.class);

    private static final int DOCUMENT_VERSION = 1;
    private static final TypeReference<LinkedHashMap<String, Object>> VALUES_TYPE = new TypeReference<>() {
    };

    /**
     * Moves the freshly written temporary file over the canonical path.
     */
    @FunctionalInterface
    public interface FileMover {
        void move(Path source, Path target) throws IOException;
    }

    public static final FileMover ATOMIC_RENAME = (source, target) -> {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    };

    private final Path path;
    private final Path tempPath;
    private final ObjectMapper objectMapper;
    private final FileMover mover;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private boolean loaded;
    private Map<String, ProfileRecord> models = Collections.emptyMap();

    public ModelProfileStore(Path path, ObjectMapper objectMapper, FileMover mover, Clock clock) {
        this.path = path;
        this.tempPath = path.resolveSibling(path.getFileName() + ".tmp");
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.mover = mover;
        this.clock = clock;
    }

    public ModelProfileStore(Path path, ObjectMapper objectMapper) {
        this(path, objectMapper, ATOMIC_RENAME, Clock.systemUTC());
    }

    /**
     * Returns a copy of the stored values, empty if the model has no profile.
     */
    public Map<String, Object> getProfile(String modelId) {
        return getRecord(modelId)
                .<Map<String, Object>>map(record -> new LinkedHashMap<>(record.values()))
                .orElseGet(LinkedHashMap::new);
    }

    public Optional<ProfileRecord> getRecord(String modelId) {
        lock.lock();
        try {
            ensureLoaded();
            return Optional.ofNullable(models.get(modelId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the whole profile. Null values are dropped; an empty result removes the entry.
     *
     * @return the values now stored
     */
    public Map<String, Object> setProfile(String modelId, Map<String, Object> values) {
        Map<String, Object> clean = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> {
                if (value != null) {
                    clean.put(key, value);
                }
            });
        }

        lock.lock();
        try {
            ensureLoaded();
            return write(modelId, clean);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Merges updates into the stored profile. A null value deletes that key.
     *
     * @return the values now stored
     */
    public Map<String, Object> patchProfile(String modelId, Map<String, Object> updates) {
        lock.lock();
        try {
            ensureLoaded();
            ProfileRecord current = models.get(modelId);
            Map<String, Object> merged = new LinkedHashMap<>(current != null ? current.values() : Map.of());
            if (updates != null) {
                updates.forEach((key, value) -> {
                    if (value == null) {
                        merged.remove(key);
                    } else {
                        merged.put(key, value);
                    }
                });
            }
            return write(modelId, merged);
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Object> write(String modelId, Map<String, Object> values) {
        Map<String, ProfileRecord> next = new TreeMap<>(models);
        if (values.isEmpty()) {
            next.remove(modelId);
        } else {
            next.put(modelId, new ProfileRecord(Instant.now(clock).toString(), values));
        }

        persist(next);
        models = Collections.unmodifiableMap(next);
        log.info("Model profile saved: modelId={}, keys={}", modelId, values.keySet());
        return new LinkedHashMap<>(values);
    }

    private void persist(Map<String, ProfileRecord> document) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ObjectNode root = objectMapper.createObjectNode();
            root.put("version", DOCUMENT_VERSION);
            root.set("models", objectMapper.valueToTree(document));
            Files.writeString(tempPath, objectMapper.writeValueAsString(root), StandardCharsets.UTF_8);
            mover.move(tempPath, path);
        } catch (IOException e) {
            log.error("Failed to persist model profiles: path={}, error={}", path, e.getMessage());
            throw new ProfileStoreException("Failed to persist model profiles to " + path, e);
        }
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        models = Collections.unmodifiableMap(readDocument());
        loaded = true;
        log.info("Model profiles loaded: path={}, models={}", path, models.size());
    }

    private Map<String, ProfileRecord> readDocument() {
        Map<String, ProfileRecord> result = new TreeMap<>();
        if (!Files.exists(path)) {
            return result;
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
            JsonNode entries = root == null ? null : root.get("models");
            if (entries == null || !entries.isObject()) {
                return result;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                JsonNode values = entry.getValue().get("values");
                if (values == null || !values.isObject() || values.isEmpty()) {
                    continue;
                }
                result.put(entry.getKey(), new ProfileRecord(
                        entry.getValue().path("updated_at").asText(null),
                        objectMapper.convertValue(values, VALUES_TYPE)));
            }
        } catch (IOException e) {
            log.warn("Model profile file unreadable, starting empty: path={}, error={}", path, e.getMessage());
            result.clear();
        }
        return result;
    }

    public Path getPath() {
        return path;
    }
}
