package fr.lapetina.synapse.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Result of a single backend health probe.
 *
 * HEALTHY: probe answered 200
 * UNHEALTHY: probe answered with another status
 * UNREACHABLE: no HTTP answer at all (refused, timed out, DNS...)
 */
public enum HealthStatus {
    HEALTHY(2),
    UNHEALTHY(1),
    UNREACHABLE(0);

    private final int gaugeValue;

    HealthStatus(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    public int getGaugeValue() {
        return gaugeValue;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
