package fr.lapetina.synapse.gateway.feed;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the feed counters.
 *
 * @param bufferSize                 events currently kept for backlog reads
 * @param subscriberCount            live subscriptions
 * @param droppedEvents              events evicted from or refused by subscriber queues
 * @param rejectedEvents             events dropped because the ring buffer was full
 * @param distributedPublishFailures distributor calls that failed or were refused
 */
public record FeedStats(
        @JsonProperty("buffer_size") int bufferSize,
        @JsonProperty("subscriber_count") int subscriberCount,
        @JsonProperty("dropped_events") long droppedEvents,
        @JsonProperty("rejected_events") long rejectedEvents,
        @JsonProperty("distributed_publish_failures") long distributedPublishFailures
) {
}
