/**
 * Synapse Gateway - one HTTP surface in front of a fleet of AI inference services.
 *
 * <p>The gateway forwards chat, embeddings and audio traffic to its backends with
 * per-backend circuit breaking and retry, makes sure the requested LLM is loaded
 * before a chat completion is forwarded, merges stored per-model generation defaults
 * into requests, and streams a redacted operator log feed over Server-Sent Events.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.synapse.gateway.GatewayFactory} - wires every component from
 *       YAML configuration</li>
 *   <li>{@link fr.lapetina.synapse.gateway.SynapseGatewayApplication} - standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("gateway.yaml").start()) {
 *     Backend router = factory.getBackendRegistry().require("llama-router");
 *     factory.getOrchestrator().ensureModelLoaded(router, "Qwen3-8B-Q4_K_M");
 * }
 * }</pre>
 *
 * @see fr.lapetina.synapse.gateway.GatewayFactory
 * @see fr.lapetina.synapse.gateway.feed.TerminalFeed
 */
package fr.lapetina.synapse.gateway;
