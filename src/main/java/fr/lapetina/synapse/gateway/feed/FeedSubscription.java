package fr.lapetina.synapse.gateway.feed;

import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded FIFO of events for one live reader.
 *
 * Only the feed owner thread offers into the queue; the reader polls from its own thread.
 * A subscription that could not keep up is detached by the feed and receives nothing more;
 * what was already queued stays readable through {@link #drain()}.
 */
public final class FeedSubscription {

    /**
     * Why a subscription stopped receiving events. The first reason recorded wins.
     */
    public enum CloseReason {
        UNSUBSCRIBED("unsubscribed"),
        SLOW_READER("slow_reader"),
        FEED_CLOSED("feed_closed");

        private final String wireValue;

        CloseReason(String wireValue) {
            this.wireValue = wireValue;
        }

        public String getWireValue() {
            return wireValue;
        }
    }

    private static final AtomicLong IDS = new AtomicLong();

    private final long id = IDS.incrementAndGet();
    private final BlockingQueue<TerminalEvent> queue;
    private final FeedQuery query;
    private volatile List<TerminalEvent> backlog = List.of();
    private final AtomicReference<CloseReason> closeReason = new AtomicReference<>();

    FeedSubscription(int capacity, FeedQuery query) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.query = query;
    }

    public long getId() {
        return id;
    }

    public FeedQuery getQuery() {
        return query;
    }

    /**
     * Events that matched the query when the subscription was registered, oldest first.
     */
    public List<TerminalEvent> getBacklog() {
        return backlog;
    }

    void setBacklog(List<TerminalEvent> backlog) {
        this.backlog = List.copyOf(backlog);
    }

    /**
     * Waits up to the timeout for the next event.
     *
     * @return the event, or null on timeout
     */
    public TerminalEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Removes and returns everything still queued, oldest first.
     */
    public List<TerminalEvent> drain() {
        List<TerminalEvent> remaining = new ArrayList<>(queue.size());
        queue.drainTo(remaining);
        return remaining;
    }

    public boolean isClosed() {
        return closeReason.get() != null;
    }

    /**
     * @return the reason recorded when the subscription was closed, null while open
     */
    public CloseReason getCloseReason() {
        return closeReason.get();
    }

    public int size() {
        return queue.size();
    }

    boolean offer(TerminalEvent event) {
        return !isClosed() && queue.offer(event);
    }

    TerminalEvent evictOldest() {
        return queue.poll();
    }

    boolean isFull() {
        return queue.remainingCapacity() == 0;
    }

    void close(CloseReason reason) {
        closeReason.compareAndSet(null, reason);
    }

    @Override
    public String toString() {
        return "FeedSubscription{id=" + id + ", queued=" + queue.size() + ", closed=" + closeReason.get() + '}';
    }
}
