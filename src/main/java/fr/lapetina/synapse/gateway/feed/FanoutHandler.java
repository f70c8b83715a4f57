package fr.lapetina.synapse.gateway.feed;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single consumer of the feed ring buffer and sole owner of the history
 * buffer and subscriber set. Because every mutation happens on this thread,
 * buffering, fan-out and subscription changes need no locks and a new
 * subscriber's backlog and live stream never overlap or leave a gap.
 */
final class FanoutHandler implements EventHandler<FeedCommand> {

    private static final Logger log = LoggerFactory.getLogger(FanoutHandler.class);

    private final int bufferCapacity;
    private final Deque<TerminalEvent> buffer;
    private final Set<FeedSubscription> subscribers = new LinkedHashSet<>();

    private final Executor distributionExecutor;
    private volatile FeedDistributor distributor;

    // Read from other threads by stats()
    private final AtomicInteger bufferSize = new AtomicInteger();
    private final AtomicInteger subscriberCount = new AtomicInteger();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final AtomicLong distributionFailures = new AtomicLong();

    FanoutHandler(int bufferCapacity, Executor distributionExecutor) {
        this.bufferCapacity = bufferCapacity;
        this.buffer = new ArrayDeque<>(bufferCapacity);
        this.distributionExecutor = distributionExecutor;
    }

    @Override
    public void onEvent(FeedCommand command, long sequence, boolean endOfBatch) {
        CompletableFuture<List<TerminalEvent>> reply = command.getReply();
        try {
            switch (command.getType()) {
                case PUBLISH -> {
                    append(command.getEvent());
                    distribute(command.getEvent());
                }
                case INGEST -> append(command.getEvent());
                case SUBSCRIBE -> {
                    FeedSubscription subscription = command.getSubscription();
                    subscription.setBacklog(backlog(command.getQuery()));
                    subscribers.add(subscription);
                    subscriberCount.set(subscribers.size());
                    reply.complete(subscription.getBacklog());
                }
                case UNSUBSCRIBE -> {
                    FeedSubscription subscription = command.getSubscription();
                    subscription.close(FeedSubscription.CloseReason.UNSUBSCRIBED);
                    subscribers.remove(subscription);
                    subscriberCount.set(subscribers.size());
                    reply.complete(List.of());
                }
                case BACKLOG -> reply.complete(backlog(command.getQuery()));
                default -> log.warn("Ignoring feed command without type: sequence={}", sequence);
            }
        } catch (RuntimeException e) {
            if (reply != null) {
                reply.completeExceptionally(e);
            }
            throw e;
        } finally {
            command.clear();
        }
    }

    private void append(TerminalEvent event) {
        if (buffer.size() == bufferCapacity) {
            buffer.pollFirst();
        }
        buffer.addLast(event);
        bufferSize.set(buffer.size());

        Iterator<FeedSubscription> it = subscribers.iterator();
        while (it.hasNext()) {
            FeedSubscription subscription = it.next();
            if (!deliver(subscription, event)) {
                subscription.close(FeedSubscription.CloseReason.SLOW_READER);
                it.remove();
                log.debug("Detached slow terminal subscriber: id={}", subscription.getId());
            }
        }
        subscriberCount.set(subscribers.size());
    }

    /**
     * Offers the event, evicting the subscriber's oldest queued event when full.
     *
     * @return false when the subscriber must be detached
     */
    private boolean deliver(FeedSubscription subscription, TerminalEvent event) {
        if (subscription.isClosed()) {
            return false;
        }
        if (subscription.isFull() && subscription.evictOldest() != null) {
            droppedEvents.incrementAndGet();
        }
        if (subscription.offer(event)) {
            return true;
        }
        droppedEvents.incrementAndGet();
        return false;
    }

    private void distribute(TerminalEvent event) {
        FeedDistributor target = distributor;
        if (target == null) {
            return;
        }
        try {
            distributionExecutor.execute(() -> {
                try {
                    target.distribute(event);
                } catch (Exception e) {
                    distributionFailures.incrementAndGet();
                    log.debug("Terminal event distribution failed: error={}", e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            distributionFailures.incrementAndGet();
        }
    }

    /**
     * Newest-first walk collecting up to {@code limit} matches, returned oldest first.
     */
    List<TerminalEvent> backlog(FeedQuery query) {
        if (buffer.isEmpty()) {
            return List.of();
        }
        int limit = Math.max(1, Math.min(query.limit(), buffer.size()));
        List<TerminalEvent> selected = new ArrayList<>(limit);
        Iterator<TerminalEvent> newestFirst = buffer.descendingIterator();
        while (newestFirst.hasNext() && selected.size() < limit) {
            TerminalEvent event = newestFirst.next();
            if (query.matches(event)) {
                selected.add(event);
            }
        }
        Collections.reverse(selected);
        return List.copyOf(selected);
    }

    /**
     * Marks every subscriber closed; used on shutdown so readers stop waiting.
     */
    void closeAll() {
        for (FeedSubscription subscription : subscribers) {
            subscription.close(FeedSubscription.CloseReason.FEED_CLOSED);
        }
    }

    void setDistributor(FeedDistributor distributor) {
        this.distributor = distributor;
    }

    int getBufferSize() {
        return bufferSize.get();
    }

    int getSubscriberCount() {
        return subscriberCount.get();
    }

    long getDroppedEvents() {
        return droppedEvents.get();
    }

    long getDistributionFailures() {
        return distributionFailures.get();
    }
}
