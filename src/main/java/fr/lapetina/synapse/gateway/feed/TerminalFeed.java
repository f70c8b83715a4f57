package fr.lapetina.synapse.gateway.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.synapse.gateway.domain.model.LogLevel;
import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;
import fr.lapetina.synapse.gateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Operator terminal feed: a bounded history of sanitized log lines plus live
 * fan-out to subscribers.
 *
 * Producers (any thread, including logging) claim ring buffer slots with
 * {@code tryNext()} so publishing never blocks; when the ring is full the event
 * is dropped and counted. A single {@link FanoutHandler} consumer owns the
 * history buffer and the subscriber set. Subscribe, unsubscribe and backlog
 * reads travel through the same ring so they observe a consistent state.
 */
public final class TerminalFeed implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TerminalFeed.class);

    static final int MIN_BUFFER_SIZE = 10;
    static final int MIN_QUEUE_SIZE = 10;
    static final int MIN_LINE_CHARS = 256;
    static final int MAX_SOURCE_CHARS = 120;
    static final int MAX_TS_CHARS = 64;
    static final String TRUNCATED_SUFFIX = "...[truncated]";
    static final String DEFAULT_SOURCE = "gateway";
    static final String EXTERNAL = "external";
    private static final Duration CONTROL_TIMEOUT = Duration.ofSeconds(5);

    private final Disruptor<FeedCommand> disruptor;
    private final RingBuffer<FeedCommand> ringBuffer;
    private final FanoutHandler fanout;
    private final ThreadPoolExecutor distributionExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong rejectedEvents = new AtomicLong();

    private final LogRedactor redactor;
    private final int bufferSize;
    private final int subscriberQueueSize;
    private final int maxLineChars;
    private final String instanceId;
    private final Clock clock;

    private TerminalFeed(Builder builder) {
        this.redactor = builder.redactor != null ? builder.redactor : new LogRedactor();
        this.bufferSize = Math.max(MIN_BUFFER_SIZE, builder.bufferSize);
        this.subscriberQueueSize = Math.max(MIN_QUEUE_SIZE, builder.subscriberQueueSize);
        this.maxLineChars = Math.max(MIN_LINE_CHARS, builder.maxLineChars);
        this.instanceId = Objects.requireNonNull(builder.instanceId, "Instance id is required");
        this.clock = builder.clock;

        this.distributionExecutor = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(builder.distributionQueueSize),
                new FeedThreadFactory("terminal-feed-distributor")
        );
        this.fanout = new FanoutHandler(bufferSize, distributionExecutor);

        this.disruptor = new Disruptor<>(
                new FeedCommandFactory(),
                builder.ringBufferSize,
                new FeedThreadFactory("terminal-feed"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(fanout);
        disruptor.setDefaultExceptionHandler(new FeedExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        if (builder.metrics != null) {
            registerGauges(builder.metrics);
        }

        log.info("TerminalFeed created: instance={}, bufferSize={}, subscriberQueueSize={}, ringBufferSize={}",
                instanceId, bufferSize, subscriberQueueSize, builder.ringBufferSize);
    }

    public void start() {
        if (!closed.get() && running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("TerminalFeed started: instance={}", instanceId);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Publishes a locally produced line. Never blocks.
     *
     * @return false when the line was dropped because the ring buffer is full or the feed is closed
     */
    public boolean publish(String source, LogLevel level, String message) {
        TerminalEvent event = new TerminalEvent(
                now(),
                normalizeSource(source, DEFAULT_SOURCE),
                level != null ? level : LogLevel.INFO,
                sanitize(message),
                instanceId
        );
        return offer(event, false);
    }

    /**
     * Accepts an event produced by another replica. It is buffered and fanned
     * out locally but never handed back to the distributor. Events carrying
     * this instance's id are ignored.
     *
     * @return true when the event was queued
     */
    public boolean ingestExternal(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return false;
        }
        String instance = cap(text(payload, "instance"), MAX_SOURCE_CHARS);
        if (instance.isEmpty()) {
            instance = EXTERNAL;
        }
        if (instance.equals(instanceId)) {
            return false;
        }
        String ts = cap(text(payload, "ts"), MAX_TS_CHARS);
        TerminalEvent event = new TerminalEvent(
                ts.isEmpty() ? now() : ts,
                normalizeSource(text(payload, "source"), EXTERNAL),
                LogLevel.parse(text(payload, "level"), LogLevel.INFO),
                sanitize(text(payload, "message")),
                instance
        );
        return offer(event, true);
    }

    private boolean offer(TerminalEvent event, boolean external) {
        if (closed.get()) {
            return false;
        }
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            rejectedEvents.incrementAndGet();
            return false;
        }
        try {
            FeedCommand command = ringBuffer.get(sequence);
            if (external) {
                command.asIngest(event);
            } else {
                command.asPublish(event);
            }
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    /**
     * Registers a live subscriber. The backlog matching the query is captured
     * in the same step, so nothing published afterwards is missed or repeated.
     */
    public FeedSubscription subscribe(FeedQuery query) {
        FeedSubscription subscription = new FeedSubscription(subscriberQueueSize, query);
        control(command -> command.asSubscribe(subscription, new CompletableFuture<>()));
        log.debug("Terminal subscriber added: id={}", subscription.getId());
        return subscription;
    }

    public void unsubscribe(FeedSubscription subscription) {
        if (subscription == null) {
            return;
        }
        subscription.close(FeedSubscription.CloseReason.UNSUBSCRIBED);
        if (running.get() && !closed.get()) {
            control(command -> command.asUnsubscribe(subscription, new CompletableFuture<>()));
        }
        log.debug("Terminal subscriber removed: id={}", subscription.getId());
    }

    /**
     * Returns up to {@code query.limit()} buffered events matching the query, oldest first.
     */
    public List<TerminalEvent> backlog(FeedQuery query) {
        return control(command -> command.asBacklog(query, new CompletableFuture<>()));
    }

    private List<TerminalEvent> control(Consumer<FeedCommand> initializer) {
        if (!running.get() || closed.get()) {
            throw new IllegalStateException("Terminal feed is not running");
        }
        CompletableFuture<List<TerminalEvent>> reply;
        long sequence = ringBuffer.next();
        try {
            FeedCommand command = ringBuffer.get(sequence);
            initializer.accept(command);
            reply = command.getReply();
        } finally {
            ringBuffer.publish(sequence);
        }
        try {
            return reply.get(CONTROL_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for terminal feed", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Terminal feed command failed", e.getCause());
        } catch (java.util.concurrent.TimeoutException e) {
            throw new IllegalStateException("Terminal feed did not respond in time", e);
        }
    }

    public void setDistributor(FeedDistributor distributor) {
        fanout.setDistributor(distributor);
    }

    public FeedStats stats() {
        return new FeedStats(
                fanout.getBufferSize(),
                fanout.getSubscriberCount(),
                fanout.getDroppedEvents(),
                rejectedEvents.get(),
                fanout.getDistributionFailures()
        );
    }

    public String getInstanceId() {
        return instanceId;
    }

    public int getBufferCapacity() {
        return bufferSize;
    }

    public int getSubscriberQueueSize() {
        return subscriberQueueSize;
    }

    public int getMaxLineChars() {
        return maxLineChars;
    }

    /**
     * Flattens, redacts and truncates a message so it renders on a single terminal line.
     */
    String sanitize(String message) {
        if (message == null) {
            return "";
        }
        String flattened = message.replace("\r", " ").replace("\n", " \\n ");
        String redacted = redactor.redact(flattened);
        if (redacted.length() > maxLineChars) {
            return redacted.substring(0, maxLineChars - 12) + TRUNCATED_SUFFIX;
        }
        return redacted;
    }

    private static String normalizeSource(String source, String fallback) {
        String trimmed = cap(source, MAX_SOURCE_CHARS);
        return trimmed.isEmpty() ? fallback : trimmed;
    }

    private static String cap(String value, int max) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        return trimmed.length() > max ? trimmed.substring(0, max) : trimmed;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private String now() {
        return DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.MILLIS));
    }

    private void registerGauges(MetricsRegistry metrics) {
        metrics.registerGauge("terminal_feed_buffer_size", "Events held for backlog reads", fanout::getBufferSize);
        metrics.registerGauge("terminal_feed_subscribers", "Live terminal subscribers", fanout::getSubscriberCount);
        metrics.registerGauge("terminal_feed_dropped_events", "Events dropped by slow subscribers", fanout::getDroppedEvents);
        metrics.registerGauge("terminal_feed_rejected_events", "Events dropped on a full ring buffer", rejectedEvents::get);
        metrics.registerGauge("terminal_feed_distribution_failures", "Failed cross-replica publishes", fanout::getDistributionFailures);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down TerminalFeed...");
        if (running.getAndSet(false)) {
            try {
                disruptor.shutdown(5, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("TerminalFeed shutdown timed out, halting...");
                disruptor.halt();
            }
        }
        fanout.closeAll();
        distributionExecutor.shutdown();
        try {
            if (!distributionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                distributionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            distributionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name == null ? "" : name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class FeedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        FeedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class FeedExceptionHandler implements ExceptionHandler<FeedCommand> {

        private static final Logger log = LoggerFactory.getLogger(FeedExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, FeedCommand command) {
            log.error("Exception in terminal feed handler: sequence={}", sequence, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during terminal feed start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during terminal feed shutdown", ex);
        }
    }

    /**
     * Builder for TerminalFeed.
     */
    public static final class Builder {
        private int bufferSize = 2000;
        private int subscriberQueueSize = 500;
        private int maxLineChars = 4000;
        private int ringBufferSize = 1024;
        private int distributionQueueSize = 1024;
        private String waitStrategy = "blocking";
        private String instanceId;
        private LogRedactor redactor;
        private MetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder subscriberQueueSize(int subscriberQueueSize) {
            this.subscriberQueueSize = subscriberQueueSize;
            return this;
        }

        public Builder maxLineChars(int maxLineChars) {
            this.maxLineChars = maxLineChars;
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder distributionQueueSize(int size) {
            this.distributionQueueSize = Math.max(1, size);
            return this;
        }

        public Builder waitStrategy(String waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder redactor(LogRedactor redactor) {
            this.redactor = redactor;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TerminalFeed build() {
            return new TerminalFeed(this);
        }
    }
}
