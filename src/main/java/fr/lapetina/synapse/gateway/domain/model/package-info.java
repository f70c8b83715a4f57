/**
 * Domain model classes shared across the gateway.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.synapse.gateway.domain.model.TimeoutClass} - Named timeout policies per kind of backend call</li>
 *   <li>{@link fr.lapetina.synapse.gateway.domain.model.ModelLoadState} - Router snapshot of one model</li>
 *   <li>{@link fr.lapetina.synapse.gateway.domain.model.ModelStatus} - Model lifecycle status with permissiveness rank</li>
 *   <li>{@link fr.lapetina.synapse.gateway.domain.model.TerminalEvent} - Immutable sanitized operator log line</li>
 *   <li>{@link fr.lapetina.synapse.gateway.domain.model.LogLevel} - Feed severities ordered by rank</li>
 *   <li>{@link fr.lapetina.synapse.gateway.domain.model.HealthStatus} - Outcome of a backend health probe</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Everything here is an enum or an immutable record and can be shared freely between threads.
 */
package fr.lapetina.synapse.gateway.domain.model;
