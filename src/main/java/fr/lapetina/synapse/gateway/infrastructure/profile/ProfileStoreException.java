package fr.lapetina.synapse.gateway.infrastructure.profile;

/**
 * The profile document could not be written. The previous document is still in place.
 */
public class ProfileStoreException extends RuntimeException {

    public ProfileStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
