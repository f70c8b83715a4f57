package fr.lapetina.synapse.gateway.infrastructure.health;

import fr.lapetina.synapse.gateway.infrastructure.http.BackendException;

/**
 * A route referred to a backend name missing from the registry.
 */
public final class UnknownBackendException extends BackendException {

    public UnknownBackendException(String backendName) {
        super(backendName, "Backend not configured: " + backendName);
    }
}
