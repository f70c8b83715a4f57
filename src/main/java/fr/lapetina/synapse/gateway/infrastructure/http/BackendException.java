package fr.lapetina.synapse.gateway.infrastructure.http;

/**
 * Base class for failures talking to a backend.
 */
public class BackendException extends RuntimeException {

    private final String backendName;

    public BackendException(String backendName, String message) {
        super(message);
        this.backendName = backendName;
    }

    public BackendException(String backendName, String message, Throwable cause) {
        super(message, cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
