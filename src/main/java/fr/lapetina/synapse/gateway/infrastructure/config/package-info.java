/**
 * Configuration loading and hot-reload support.
 *
 * <p>The YAML file is bound onto {@link fr.lapetina.synapse.gateway.infrastructure.config.GatewayConfig}
 * with SnakeYAML. Its location comes from the first command line argument, the
 * {@code SYNAPSE_GATEWAY_CONFIG} environment variable, or {@code gateway.yaml}.
 *
 * <h2>Hot-Reload</h2>
 * <p>When the file changes, registered listeners are notified. Only the backend
 * registry follows reloads; timeouts, pool settings and the terminal feed are fixed at startup.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings</li>
 *   <li>{@code backends} - downstream services and their health paths</li>
 *   <li>{@code routes} - passthrough prefixes</li>
 *   <li>{@code http}, {@code timeouts}, {@code retry}, {@code circuitBreaker} - dispatch client</li>
 *   <li>{@code llm} - model selection and load orchestration</li>
 *   <li>{@code profiles} - model profile document location</li>
 *   <li>{@code terminalFeed} - operator log feed and its cross-replica bus</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.synapse.gateway.infrastructure.config;
