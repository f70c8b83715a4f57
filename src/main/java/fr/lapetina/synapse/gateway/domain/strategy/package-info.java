/**
 * Model selection for chat completion requests.
 *
 * <p>Strategies decide which model serves a request when the caller did not name
 * one, or named an auto alias such as {@code auto}. An explicit model always wins.
 *
 * <h2>Available Strategies</h2>
 * <ul>
 *   <li>{@link fr.lapetina.synapse.gateway.domain.strategy.KeywordModelSelector} - programming terms pick the coder model, everything else the general model</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Strategies are stateless after construction and safe to share between request threads.
 */
package fr.lapetina.synapse.gateway.domain.strategy;
