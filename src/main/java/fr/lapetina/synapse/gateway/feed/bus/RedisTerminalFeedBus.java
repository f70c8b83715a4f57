package fr.lapetina.synapse.gateway.feed.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;
import fr.lapetina.synapse.gateway.feed.FeedDistributor;
import fr.lapetina.synapse.gateway.feed.TerminalFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPubSub;
import redis.clients.jedis.exceptions.JedisException;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shares terminal lines between gateway replicas over a Redis pub/sub channel.
 *
 * Local events are published as JSON through a pooled connection. A dedicated
 * thread holds the subscription, reconnecting with exponential backoff
 * (1 s doubling up to 15 s) whenever Redis goes away. Messages stamped with this
 * replica's instance id are ignored so a replica never sees its own lines twice.
 */
public final class RedisTerminalFeedBus implements FeedDistributor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisTerminalFeedBus.class);

    static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    static final Duration MAX_BACKOFF = Duration.ofSeconds(15);

    private final TerminalFeed feed;
    private final ObjectMapper objectMapper;
    private final URI redisUri;
    private final String channel;
    private final int timeoutMs;
    private final JedisPool publishPool;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread subscriberThread;
    private volatile JedisPubSub activeSubscription;
    private volatile Duration backoff = INITIAL_BACKOFF;

    public RedisTerminalFeedBus(TerminalFeed feed, ObjectMapper objectMapper,
                                String redisUrl, String channel, int timeoutMs) {
        this(feed, objectMapper, URI.create(redisUrl), channel, timeoutMs,
                new JedisPool(URI.create(redisUrl), timeoutMs));
    }

    RedisTerminalFeedBus(TerminalFeed feed, ObjectMapper objectMapper, URI redisUri,
                         String channel, int timeoutMs, JedisPool publishPool) {
        this.feed = feed;
        this.objectMapper = objectMapper;
        this.redisUri = redisUri;
        this.channel = channel;
        this.timeoutMs = timeoutMs;
        this.publishPool = publishPool;
    }

    /**
     * Starts the subscriber thread and registers this bus as the feed's distributor.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        feed.setDistributor(this);
        Thread thread = new Thread(this::subscribeLoop, "terminal-feed-redis");
        thread.setDaemon(true);
        subscriberThread = thread;
        thread.start();
        log.info("Redis terminal bus started: channel={}, instance={}", channel, feed.getInstanceId());
    }

    @Override
    public void distribute(TerminalEvent event) throws JsonProcessingException {
        String payload = objectMapper.writeValueAsString(event);
        try (Jedis jedis = publishPool.getResource()) {
            jedis.publish(channel, payload);
        }
    }

    private void subscribeLoop() {
        while (running.get()) {
            try (Jedis jedis = new Jedis(redisUri, timeoutMs)) {
                JedisPubSub subscription = new ChannelListener();
                activeSubscription = subscription;
                // Blocks until unsubscribed or the connection drops
                jedis.subscribe(subscription, channel);
            } catch (JedisException e) {
                if (!running.get()) {
                    break;
                }
                Duration wait = backoff;
                log.warn("Redis terminal bus disconnected, retrying: channel={}, retryInMs={}, error={}",
                        channel, wait.toMillis(), e.getMessage());
                backoff = nextBackoff(wait);
                if (!pause(wait)) {
                    break;
                }
            } finally {
                activeSubscription = null;
            }
        }
        log.debug("Redis terminal subscriber stopped: channel={}", channel);
    }

    private boolean pause(Duration wait) {
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static Duration nextBackoff(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : doubled;
    }

    /**
     * Parses one channel message and ingests it unless it originated here.
     *
     * @return true when the event was handed to the feed
     */
    boolean handleMessage(String message) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(message);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed terminal bus message: error={}", e.getOriginalMessage());
            return false;
        }
        if (payload == null || !payload.isObject()) {
            return false;
        }
        JsonNode instance = payload.get("instance");
        if (instance != null && feed.getInstanceId().equals(instance.asText())) {
            return false;
        }
        return feed.ingestExternal(payload);
    }

    Duration currentBackoff() {
        return backoff;
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            publishPool.close();
            return;
        }
        feed.setDistributor(null);
        JedisPubSub subscription = activeSubscription;
        if (subscription != null && subscription.isSubscribed()) {
            try {
                subscription.unsubscribe();
            } catch (JedisException e) {
                log.debug("Redis unsubscribe failed during shutdown: error={}", e.getMessage());
            }
        }
        Thread thread = subscriberThread;
        if (thread != null) {
            thread.interrupt();
        }
        publishPool.close();
        log.info("Redis terminal bus stopped: channel={}", channel);
    }

    private final class ChannelListener extends JedisPubSub {

        @Override
        public void onSubscribe(String subscribedChannel, int subscribedChannels) {
            backoff = INITIAL_BACKOFF;
            log.info("Redis terminal bus subscribed: channel={}", subscribedChannel);
        }

        @Override
        public void onMessage(String messageChannel, String message) {
            handleMessage(message);
        }
    }
}
