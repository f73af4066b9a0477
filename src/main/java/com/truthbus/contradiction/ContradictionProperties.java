package com.truthbus.contradiction;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param maxRelativeSpread relative spread at which numeric disagreement saturates at 1.0
 */
@ConfigurationProperties(prefix = "truthbus.contradiction")
public record ContradictionProperties(Double maxRelativeSpread) {

    public ContradictionProperties {
        if (maxRelativeSpread == null) {
            maxRelativeSpread = 0.25;
        }
        if (maxRelativeSpread <= 0.0) {
            throw new IllegalArgumentException("truthbus.contradiction.max-relative-spread must be > 0");
        }
    }
}
