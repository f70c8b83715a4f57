package fr.lapetina.synapse.gateway.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one router model entry: id, lifecycle status, failure flag and launch arguments.
 */
public record ModelLoadState(
        String id,
        ModelStatus status,
        boolean failed,
        List<String> args
) {
    public ModelLoadState {
        Objects.requireNonNull(id, "Model id is required");
        status = status != null ? status : ModelStatus.UNKNOWN;
        args = args != null ? List.copyOf(args) : List.of();
    }

    public boolean isLoaded() {
        return status == ModelStatus.LOADED;
    }

    public boolean isLoading() {
        return status == ModelStatus.LOADING;
    }
}
