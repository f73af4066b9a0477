package com.truthbus.state;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "truthbus.confidence")
public record ConfidenceProperties(
    Double baseline,
    Double corroborationBonus,
    Double sharedUpstreamPenalty,
    Double lowIndependenceThreshold,
    Double archetypalBonus,
    Double contradictionPenalty
) {

    public ConfidenceProperties {
        baseline = orDefault(baseline, 0.5, "baseline");
        corroborationBonus = orDefault(corroborationBonus, 0.2, "corroboration-bonus");
        sharedUpstreamPenalty = orDefault(sharedUpstreamPenalty, 0.2, "shared-upstream-penalty");
        lowIndependenceThreshold = orDefault(lowIndependenceThreshold, 0.5, "low-independence-threshold");
        archetypalBonus = orDefault(archetypalBonus, 0.2, "archetypal-bonus");
        contradictionPenalty = orDefault(contradictionPenalty, 0.3, "contradiction-penalty");
    }

    public static ConfidenceProperties defaults() {
        return new ConfidenceProperties(null, null, null, null, null, null);
    }

    private static Double orDefault(Double value, double fallback, String name) {
        double resolved = value == null ? fallback : value;
        if (resolved < 0.0 || resolved > 1.0) {
            throw new IllegalArgumentException("truthbus.confidence." + name + " must be within [0,1]");
        }
        return resolved;
    }
}
