package fr.lapetina.synapse.gateway.orchestration;

/**
 * Terminal result of waiting for a model to load.
 */
public enum LoadOutcome {
    LOADED,
    FAILED,
    TIMED_OUT
}
