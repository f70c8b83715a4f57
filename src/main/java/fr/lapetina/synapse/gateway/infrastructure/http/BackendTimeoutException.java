package fr.lapetina.synapse.gateway.infrastructure.http;

/**
 * The backend accepted the connection but did not answer within the timeout class budget.
 * Never retried and never counted against the circuit breaker.
 */
public final class BackendTimeoutException extends BackendException {

    public BackendTimeoutException(String backendName, String message, Throwable cause) {
        super(backendName, message, cause);
    }
}
