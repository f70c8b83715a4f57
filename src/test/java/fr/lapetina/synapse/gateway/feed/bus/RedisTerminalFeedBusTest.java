package fr.lapetina.synapse.gateway.feed.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.synapse.gateway.domain.model.LogLevel;
import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;
import fr.lapetina.synapse.gateway.feed.FeedQuery;
import fr.lapetina.synapse.gateway.feed.TerminalFeed;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.JedisPool;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RedisTerminalFeedBusTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private TerminalFeed feed;
    private RedisTerminalFeedBus bus;

    @BeforeEach
    void setUp() {
        feed = TerminalFeed.builder().instanceId("gw-a").build();
        feed.start();
        URI uri = URI.create("redis://127.0.0.1:6379");
        // The pool connects lazily, so no Redis server is needed for message handling
        bus = new RedisTerminalFeedBus(feed, mapper, uri, "synapse:terminal", 500, new JedisPool(uri, 500));
    }

    @AfterEach
    void tearDown() {
        bus.close();
        feed.close();
    }

    private List<TerminalEvent> events() {
        return feed.backlog(new FeedQuery(50, LogLevel.DEBUG, null));
    }

    @Test
    @DisplayName("should ingest events published by other replicas")
    void shouldIngestForeignEvents() throws Exception {
        String message = mapper.writeValueAsString(
                new TerminalEvent("2026-03-01T10:00:00Z", "router", LogLevel.ERROR, "model crashed", "gw-b"));

        assertThat(bus.handleMessage(message)).isTrue();

        assertThat(events()).containsExactly(
                new TerminalEvent("2026-03-01T10:00:00Z", "router", LogLevel.ERROR, "model crashed", "gw-b"));
    }

    @Test
    @DisplayName("should ignore its own events coming back from the channel")
    void shouldSuppressEcho() throws Exception {
        String message = mapper.writeValueAsString(
                new TerminalEvent("2026-03-01T10:00:00Z", "gateway", LogLevel.INFO, "hello", "gw-a"));

        assertThat(bus.handleMessage(message)).isFalse();
        assertThat(events()).isEmpty();
    }

    @Test
    @DisplayName("should drop malformed messages")
    void shouldDropMalformed() {
        assertThat(bus.handleMessage("{not json")).isFalse();
        assertThat(bus.handleMessage("[1,2,3]")).isFalse();
        assertThat(bus.handleMessage("\"text\"")).isFalse();
        assertThat(events()).isEmpty();
    }

    @Test
    @DisplayName("should double the reconnect backoff up to fifteen seconds")
    void shouldCapBackoff() {
        assertThat(bus.currentBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(RedisTerminalFeedBus.nextBackoff(Duration.ofSeconds(1))).isEqualTo(Duration.ofSeconds(2));
        assertThat(RedisTerminalFeedBus.nextBackoff(Duration.ofSeconds(8))).isEqualTo(Duration.ofSeconds(15));
        assertThat(RedisTerminalFeedBus.nextBackoff(Duration.ofSeconds(15))).isEqualTo(Duration.ofSeconds(15));
    }
}
