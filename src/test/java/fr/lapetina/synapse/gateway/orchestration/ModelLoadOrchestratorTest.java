package fr.lapetina.synapse.gateway.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendUnavailableException;
import fr.lapetina.synapse.gateway.infrastructure.http.Sleeper;
import fr.lapetina.synapse.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.synapse.gateway.testing.FakeLlamaRouter;
import fr.lapetina.synapse.gateway.testing.FakeLlamaRouter.LoadBehaviour;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelLoadOrchestratorTest {

    private static final Duration POLL = Duration.ofSeconds(1);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private FakeLlamaRouter router;
    private Backend backend;
    private MetricsRegistry metrics;
    private ModelRegistryClient registry;
    private MutableClock clock;
    private final List<Duration> pollSleeps = new CopyOnWriteArrayList<>();
    private volatile Runnable onPollSleep = () -> { };

    @BeforeEach
    void setUp() throws IOException {
        router = new FakeLlamaRouter();
        backend = new Backend("llama-router", router.baseUrl(), "/health");
        metrics = new MetricsRegistry("test", false);
        BackendClient client = BackendClient.builder()
                .timeout(TimeoutClass.DEFAULT, Duration.ofSeconds(5))
                .sleeper(duration -> { })
                .metrics(metrics)
                .build();
        registry = new ModelRegistryClient(client, new ObjectMapper());
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    }

    @AfterEach
    void tearDown() {
        router.close();
        metrics.close();
    }

    private ModelLoadOrchestrator orchestrator() {
        Sleeper sleeper = duration -> {
            pollSleeps.add(duration);
            clock.advance(duration);
            onPollSleep.run();
        };
        return new ModelLoadOrchestrator(registry, metrics, POLL, TIMEOUT, true, sleeper, clock);
    }

    @Nested
    @DisplayName("ensureModelLoaded")
    class EnsureLoaded {

        @Test
        @DisplayName("should unload other models and skip the load when the target is already loaded")
        void shouldUnloadOthers() {
            router.model("Qwen3-8B", "loaded").model("gpt-oss-20b", "loaded").model("coder", "unloaded");

            orchestrator().ensureModelLoaded(backend, "Qwen3-8B");

            assertThat(router.unloads()).containsExactly("gpt-oss-20b");
            assertThat(router.loads()).isEmpty();
            assertThat(router.status("Qwen3-8B")).isEqualTo("loaded");
        }

        @Test
        @DisplayName("should load the target and wait until it reports loaded")
        void shouldLoadAndWait() {
            router.model("Qwen3-8B", "loaded").model("coder", "unloaded");
            router.setLoadBehaviour(LoadBehaviour.DEFERRED);
            onPollSleep = () -> {
                if (pollSleeps.size() == 2) {
                    router.setStatus("coder", "loaded");
                }
            };

            orchestrator().ensureModelLoaded(backend, "coder");

            assertThat(router.unloads()).containsExactly("Qwen3-8B");
            assertThat(router.loads()).containsExactly("coder");
            assertThat(pollSleeps).containsExactly(POLL, POLL);
        }

        @Test
        @DisplayName("should not issue a second load while the target is loading")
        void shouldWaitForLoadingModel() {
            router.model("coder", "loading");
            onPollSleep = () -> router.setStatus("coder", "loaded");

            orchestrator().ensureModelLoaded(backend, "coder");

            assertThat(router.loads()).isEmpty();
        }

        @Test
        @DisplayName("should load a split model through its first part and keep its siblings")
        void shouldHandleSplitModel() {
            router.model("other", "loaded")
                    .model("big-00001-of-00002", "unloaded")
                    .model("big-00002-of-00002", "unloaded");

            orchestrator().ensureModelLoaded(backend, "big-00002-of-00002");

            assertThat(router.loads()).containsExactly("big-00001-of-00002");
            assertThat(router.unloads()).containsExactly("other");
            assertThat(router.status("big-00002-of-00002")).isEqualTo("loaded");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should reject a model the router does not know")
        void shouldRejectUnknownModel() {
            router.model("coder", "loaded");

            assertThatThrownBy(() -> orchestrator().ensureModelLoaded(backend, "missing"))
                    .isInstanceOfSatisfying(ModelLoadException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(ModelLoadException.Reason.UNKNOWN_MODEL);
                        assertThat(e.getReason().getHttpStatus()).isEqualTo(400);
                        assertThat(e.getModelId()).isEqualTo("missing");
                    });
            assertThat(router.unloads()).isEmpty();
        }

        @Test
        @DisplayName("should surface the router status when it refuses the load")
        void shouldReportRejectedLoad() {
            router.model("coder", "unloaded");
            router.setLoadStatus(409);

            assertThatThrownBy(() -> orchestrator().ensureModelLoaded(backend, "coder"))
                    .isInstanceOfSatisfying(ModelLoadException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(ModelLoadException.Reason.LOAD_REJECTED);
                        assertThat(e.getUpstreamStatus()).isEqualTo(409);
                    });
        }

        @Test
        @DisplayName("should fail fast when the router flags the load as failed")
        void shouldReportFailedLoad() {
            router.model("coder", "unloaded");
            router.setLoadBehaviour(LoadBehaviour.FAIL);

            assertThatThrownBy(() -> orchestrator().ensureModelLoaded(backend, "coder"))
                    .isInstanceOfSatisfying(ModelLoadException.class, e ->
                            assertThat(e.getReason()).isEqualTo(ModelLoadException.Reason.LOAD_FAILED));
            assertThat(pollSleeps).isEmpty();
        }

        @Test
        @DisplayName("should time out when the model never finishes loading")
        void shouldTimeOut() {
            router.model("coder", "unloaded");
            router.setLoadBehaviour(LoadBehaviour.DEFERRED);

            assertThatThrownBy(() -> orchestrator().ensureModelLoaded(backend, "coder"))
                    .isInstanceOfSatisfying(ModelLoadException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(ModelLoadException.Reason.TIMED_OUT);
                        assertThat(e.getReason().getHttpStatus()).isEqualTo(504);
                    });
            assertThat(pollSleeps).hasSize(5);
        }

        @Test
        @DisplayName("should keep polling through a registry read that drops the connection")
        void shouldRideOutDroppedRegistryRead() {
            router.model("coder", "unloaded");
            router.setLoadBehaviour(LoadBehaviour.DEFERRED);
            onPollSleep = () -> {
                if (pollSleeps.size() == 1) {
                    router.setRegistryReadable(false);
                } else if (pollSleeps.size() == 2) {
                    router.setRegistryReadable(true);
                    router.setStatus("coder", "loaded");
                }
            };

            orchestrator().ensureModelLoaded(backend, "coder");

            assertThat(router.loads()).containsExactly("coder");
            assertThat(pollSleeps).containsExactly(POLL, POLL);
        }

        @Test
        @DisplayName("should time out rather than fail when the router goes away during the wait")
        void shouldTimeOutWhenRouterStopsDuringWait() {
            router.model("coder", "unloaded");
            router.setLoadBehaviour(LoadBehaviour.DEFERRED);
            onPollSleep = () -> router.close();

            assertThatThrownBy(() -> orchestrator().ensureModelLoaded(backend, "coder"))
                    .isInstanceOfSatisfying(ModelLoadException.class, e ->
                            assertThat(e.getReason()).isEqualTo(ModelLoadException.Reason.TIMED_OUT));
            assertThat(pollSleeps).hasSize(5);
        }

        @Test
        @DisplayName("should propagate an unreachable router as a backend failure")
        void shouldPropagateUnreachableRouter() throws IOException {
            String deadUrl;
            try (ServerSocket socket = new ServerSocket(0)) {
                deadUrl = "http://127.0.0.1:" + socket.getLocalPort();
            }
            Backend dead = new Backend("llama-router", deadUrl, "/health");

            assertThatThrownBy(() -> orchestrator().ensureModelLoaded(dead, "coder"))
                    .isInstanceOf(BackendUnavailableException.class);
        }
    }

    private static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
