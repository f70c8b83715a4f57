package fr.lapetina.synapse.gateway.domain.profile;

/**
 * A client payload was malformed or carried values outside what the model accepts.
 * Always answered with 400.
 */
public class RequestValidationException extends RuntimeException {

    public RequestValidationException(String message) {
        super(message);
    }

    public RequestValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
