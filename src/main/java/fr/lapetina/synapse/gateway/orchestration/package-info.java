/**
 * Model lifecycle orchestration on the LLM router.
 *
 * <p>{@link fr.lapetina.synapse.gateway.orchestration.ModelLoadOrchestrator} keeps exactly one
 * model resident: it evicts the others, loads the target and polls until a terminal state.
 * {@link fr.lapetina.synapse.gateway.orchestration.SplitModelCollapser} presents models that the
 * router reports as numbered parts as a single entry.
 * {@link fr.lapetina.synapse.gateway.orchestration.ChatCompletionPreparer} chains model selection,
 * loading and profile defaults for each chat request.
 */
package fr.lapetina.synapse.gateway.orchestration;
