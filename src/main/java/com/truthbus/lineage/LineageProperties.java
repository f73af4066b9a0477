package com.truthbus.lineage;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Static source to upstream-provider mapping, supplied by operators.
 */
@ConfigurationProperties(prefix = "truthbus.lineage")
public record LineageProperties(Map<String, List<String>> sources) {

    public LineageProperties {
        sources = sources == null ? Map.of() : Map.copyOf(sources);
    }
}
