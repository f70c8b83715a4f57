package fr.lapetina.synapse.gateway.infrastructure.http;

/**
 * Connect-class failure: the connection was refused, the connect timed out,
 * or the circuit breaker rejected the attempt before any I/O.
 */
public final class BackendUnavailableException extends BackendException {

    private final boolean circuitOpen;

    public BackendUnavailableException(String backendName, String message, Throwable cause) {
        super(backendName, message, cause);
        this.circuitOpen = false;
    }

    private BackendUnavailableException(String backendName, String message) {
        super(backendName, message);
        this.circuitOpen = true;
    }

    public static BackendUnavailableException circuitOpen(String backendName) {
        return new BackendUnavailableException(backendName, "Circuit breaker open for " + backendName);
    }

    public boolean isCircuitOpen() {
        return circuitOpen;
    }
}
