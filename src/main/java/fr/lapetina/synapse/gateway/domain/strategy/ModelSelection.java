package fr.lapetina.synapse.gateway.domain.strategy;

/**
 * Outcome of model selection for one chat request.
 *
 * @param model     model id the request will be sent to
 * @param automatic true if the caller asked for an auto alias and the selector chose
 * @param category  {@code explicit}, {@code coder} or {@code general}
 */
public record ModelSelection(String model, boolean automatic, String category) {

    public static final String EXPLICIT = "explicit";
    public static final String CODER = "coder";
    public static final String GENERAL = "general";

    public static ModelSelection explicit(String model) {
        return new ModelSelection(model, false, EXPLICIT);
    }
}
