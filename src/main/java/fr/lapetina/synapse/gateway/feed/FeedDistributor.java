package fr.lapetina.synapse.gateway.feed;

import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;

/**
 * Receives locally produced events after they were buffered and fanned out,
 * typically to relay them to other replicas. Called off the feed owner thread.
 * Exceptions are counted by the feed and otherwise ignored.
 */
@FunctionalInterface
public interface FeedDistributor {

    void distribute(TerminalEvent event) throws Exception;
}
