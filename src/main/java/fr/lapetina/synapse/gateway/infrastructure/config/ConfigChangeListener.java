package fr.lapetina.synapse.gateway.infrastructure.config;

/**
 * Notified after a configuration was loaded and validated, on startup and on every hot reload.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param oldConfig configuration being replaced, null on the first load
     * @param newConfig configuration now in effect
     */
    void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig);
}
