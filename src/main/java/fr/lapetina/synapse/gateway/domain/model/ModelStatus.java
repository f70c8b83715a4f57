package fr.lapetina.synapse.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a model as reported by the LLM router.
 * The rank orders statuses from least to most permissive and is used when
 * several split parts of one model report different statuses.
 */
public enum ModelStatus {
    UNKNOWN(0),
    UNLOADED(1),
    UNLOADING(2),
    LOADING(3),
    LOADED(4);

    private final int rank;

    ModelStatus(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public static ModelStatus mostPermissive(ModelStatus a, ModelStatus b) {
        return a.rank >= b.rank ? a : b;
    }

    public static ModelStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "loaded":
                return LOADED;
            case "loading":
                return LOADING;
            case "unloading":
                return UNLOADING;
            case "unloaded":
                return UNLOADED;
            default:
                return UNKNOWN;
        }
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
