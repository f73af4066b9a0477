package com.truthbus.state;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Thresholds for the epistemic state machine.
 *
 * @param corroborationThreshold contradiction strictly below this counts as agreement
 * @param disputeThreshold contradiction at or above this is a dispute; the band between is anomalous
 * @param archetypalMinSources minimum distinct sources for ARCHETYPAL
 * @param archetypalMinIndependence independence must be strictly above this for ARCHETYPAL
 */
@ConfigurationProperties(prefix = "truthbus.state")
public record StateProperties(
    Double corroborationThreshold,
    Double disputeThreshold,
    Integer archetypalMinSources,
    Double archetypalMinIndependence
) {

    public StateProperties {
        if (corroborationThreshold == null) {
            corroborationThreshold = 0.3;
        }
        if (disputeThreshold == null) {
            disputeThreshold = 0.7;
        }
        if (archetypalMinSources == null) {
            archetypalMinSources = 3;
        }
        if (archetypalMinIndependence == null) {
            archetypalMinIndependence = 0.5;
        }
        requireUnit(corroborationThreshold, "corroboration-threshold");
        requireUnit(disputeThreshold, "dispute-threshold");
        requireUnit(archetypalMinIndependence, "archetypal-min-independence");
        if (corroborationThreshold > disputeThreshold) {
            throw new IllegalArgumentException(
                "truthbus.state.corroboration-threshold must not exceed dispute-threshold");
        }
        if (archetypalMinSources < 2) {
            throw new IllegalArgumentException("truthbus.state.archetypal-min-sources must be >= 2");
        }
    }

    public static StateProperties defaults() {
        return new StateProperties(null, null, null, null);
    }

    private static void requireUnit(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("truthbus.state." + name + " must be within [0,1]");
        }
    }
}
