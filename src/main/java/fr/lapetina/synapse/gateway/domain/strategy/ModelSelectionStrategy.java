package fr.lapetina.synapse.gateway.domain.strategy;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Strategy interface for choosing the model of a chat completion request.
 *
 * Implementations must be thread-safe as they are called from
 * concurrent request handler threads.
 */
public interface ModelSelectionStrategy {

    /**
     * Returns the name of this strategy for configuration and logging.
     */
    String getName();

    /**
     * Picks the model for the given chat completion payload.
     * A model named explicitly by the caller must be returned unchanged
     * unless it is one of the strategy's auto aliases.
     *
     * @param payload parsed request body
     * @return the selection, never null
     */
    ModelSelection select(JsonNode payload);
}
