package fr.lapetina.synapse.gateway.feed;

import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable ring buffer slot carrying one instruction for the feed owner thread.
 *
 * Slots are pre-allocated by {@link FeedCommandFactory} and reused; every
 * producer must call one of the {@code as*} initializers after claiming a
 * sequence, and the owner clears the slot once the command was applied.
 */
public final class FeedCommand {

    public enum Type {
        /** A locally produced event: buffer, fan out, then hand to the distributor. */
        PUBLISH,
        /** An event received from another replica: buffer and fan out only. */
        INGEST,
        SUBSCRIBE,
        UNSUBSCRIBE,
        BACKLOG
    }

    private Type type;
    private TerminalEvent event;
    private FeedSubscription subscription;
    private FeedQuery query;
    private CompletableFuture<List<TerminalEvent>> reply;

    void asPublish(TerminalEvent event) {
        this.type = Type.PUBLISH;
        this.event = event;
    }

    void asIngest(TerminalEvent event) {
        this.type = Type.INGEST;
        this.event = event;
    }

    void asSubscribe(FeedSubscription subscription, CompletableFuture<List<TerminalEvent>> reply) {
        this.type = Type.SUBSCRIBE;
        this.subscription = subscription;
        this.query = subscription.getQuery();
        this.reply = reply;
    }

    void asUnsubscribe(FeedSubscription subscription, CompletableFuture<List<TerminalEvent>> reply) {
        this.type = Type.UNSUBSCRIBE;
        this.subscription = subscription;
        this.reply = reply;
    }

    void asBacklog(FeedQuery query, CompletableFuture<List<TerminalEvent>> reply) {
        this.type = Type.BACKLOG;
        this.query = query;
        this.reply = reply;
    }

    /**
     * Releases references so the slot does not pin events or subscribers.
     */
    void clear() {
        type = null;
        event = null;
        subscription = null;
        query = null;
        reply = null;
    }

    Type getType() {
        return type;
    }

    TerminalEvent getEvent() {
        return event;
    }

    FeedSubscription getSubscription() {
        return subscription;
    }

    FeedQuery getQuery() {
        return query;
    }

    CompletableFuture<List<TerminalEvent>> getReply() {
        return reply;
    }

    @Override
    public String toString() {
        return "FeedCommand{type=" + type + ", event=" + event + '}';
    }
}
