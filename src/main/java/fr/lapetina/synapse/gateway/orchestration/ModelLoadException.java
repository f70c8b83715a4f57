package fr.lapetina.synapse.gateway.orchestration;

/**
 * Terminal failure of model orchestration. Never retried automatically.
 */
public class ModelLoadException extends RuntimeException {

    public enum Reason {
        UNKNOWN_MODEL(400),
        REGISTRY_UNAVAILABLE(502),
        LOAD_REJECTED(502),
        LOAD_FAILED(502),
        TIMED_OUT(504);

        private final int httpStatus;

        Reason(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int getHttpStatus() {
            return httpStatus;
        }
    }

    private final Reason reason;
    private final String modelId;
    private final Integer upstreamStatus;

    public ModelLoadException(Reason reason, String modelId, String message) {
        this(reason, modelId, message, null);
    }

    public ModelLoadException(Reason reason, String modelId, String message, Integer upstreamStatus) {
        super(message);
        this.reason = reason;
        this.modelId = modelId;
        this.upstreamStatus = upstreamStatus;
    }

    public Reason getReason() {
        return reason;
    }

    public String getModelId() {
        return modelId;
    }

    /**
     * Status returned by the router when it rejected a command, null otherwise.
     */
    public Integer getUpstreamStatus() {
        return upstreamStatus;
    }
}
