package fr.lapetina.synapse.gateway.infrastructure.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelProfileStoreTest {

    private static final String QWEN = "Qwen3-8B-Q4_K_M";

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private Path file;
    private ModelProfileStore store;

    @BeforeEach
    void setUp() {
        file = dir.resolve("profiles").resolve("model_profiles.json");
        store = new ModelProfileStore(file, mapper, ModelProfileStore.ATOMIC_RENAME, clock);
    }

    @Test
    @DisplayName("should return an empty profile for an unknown model")
    void shouldReturnEmptyProfile() {
        assertThat(store.getProfile(QWEN)).isEmpty();
        assertThat(store.getRecord(QWEN)).isEmpty();
        assertThat(file).doesNotExist();
    }

    @Nested
    @DisplayName("patchProfile")
    class Patch {

        @Test
        @DisplayName("should merge updates into the stored values")
        void shouldMerge() {
            store.patchProfile(QWEN, Map.of("temperature", 0.7));
            Map<String, Object> result = store.patchProfile(QWEN, Map.of("top_k", 20));

            assertThat(result).containsEntry("temperature", 0.7).containsEntry("top_k", 20);
            assertThat(store.getRecord(QWEN)).hasValueSatisfying(record ->
                    assertThat(record.updatedAt()).isEqualTo("2026-03-01T10:00:00Z"));
        }

        @Test
        @DisplayName("should delete keys patched to null and drop the profile once empty")
        void shouldDeleteOnNull() {
            store.patchProfile(QWEN, Map.of("temperature", 0.7));

            Map<String, Object> updates = new HashMap<>();
            updates.put("temperature", null);
            Map<String, Object> result = store.patchProfile(QWEN, updates);

            assertThat(result).isEmpty();
            assertThat(store.getRecord(QWEN)).isEmpty();
        }
    }

    @Nested
    @DisplayName("setProfile")
    class Replace {

        @Test
        @DisplayName("should replace the whole profile and ignore null values")
        void shouldReplace() {
            store.patchProfile(QWEN, Map.of("temperature", 0.7, "top_k", 20));

            Map<String, Object> values = new LinkedHashMap<>();
            values.put("max_tokens", 1024);
            values.put("top_p", null);
            Map<String, Object> result = store.setProfile(QWEN, values);

            assertThat(result).containsOnlyKeys("max_tokens");
            assertThat(store.getProfile(QWEN)).containsOnlyKeys("max_tokens");
        }
    }

    @Nested
    @DisplayName("persistence")
    class Persistence {

        @Test
        @DisplayName("should write a versioned document readable by a new store")
        void shouldPersistDocument() throws IOException {
            store.patchProfile(QWEN, Map.of("system_prompt", "Be brief.", "temperature", 0.6));

            JsonNode root = mapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
            assertThat(root.path("version").asInt()).isEqualTo(1);
            assertThat(root.path("models").path(QWEN).path("values").path("system_prompt").asText()).isEqualTo("Be brief.");
            assertThat(root.path("models").path(QWEN).path("updated_at").asText()).isEqualTo("2026-03-01T10:00:00Z");

            ModelProfileStore reopened = new ModelProfileStore(file, mapper);
            assertThat(reopened.getProfile(QWEN))
                    .containsEntry("system_prompt", "Be brief.")
                    .containsEntry("temperature", 0.6);
            assertThat(file.resolveSibling("model_profiles.json.tmp")).doesNotExist();
        }

        @Test
        @DisplayName("should keep the previous file intact when the final rename fails")
        void shouldSurviveCrashBeforeRename() throws IOException {
            store.patchProfile(QWEN, Map.of("temperature", 0.6));
            String before = Files.readString(file, StandardCharsets.UTF_8);

            ModelProfileStore crashing = new ModelProfileStore(file, mapper, (source, target) -> {
                throw new IOException("simulated crash");
            }, clock);

            assertThatThrownBy(() -> crashing.patchProfile(QWEN, Map.of("temperature", 1.2)))
                    .isInstanceOf(ProfileStoreException.class);

            assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(before);
            assertThat(crashing.getProfile(QWEN)).containsEntry("temperature", 0.6);
        }

        @Test
        @DisplayName("should start empty when the file is corrupt")
        void shouldTolerateCorruptFile() throws IOException {
            Files.createDirectories(file.getParent());
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

            assertThat(store.getProfile(QWEN)).isEmpty();

            store.patchProfile(QWEN, Map.of("top_k", 10));
            assertThat(new ModelProfileStore(file, mapper).getProfile(QWEN)).containsEntry("top_k", 10);
        }
    }

    @Test
    @DisplayName("should not lose updates made concurrently")
    void shouldSerializeConcurrentWrites() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                String key = "key_" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    store.patchProfile(QWEN, Map.of(key, "value"));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.getProfile(QWEN)).hasSize(writers);
        assertThat(new ModelProfileStore(file, mapper).getProfile(QWEN)).hasSize(writers);
    }
}
