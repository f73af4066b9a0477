package com.truthbus.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthbus.contract.ValueKind;

import java.time.Instant;
import java.util.List;

/**
 * An accepted observation. Immutable once recorded.
 */
public record RecordedObservation(
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("value") Object value,
    @JsonProperty("value_kind") ValueKind valueKind,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("upstream_lineage") List<String> upstreamLineage,
    @JsonProperty("recorded_at") Instant recordedAt
) {

    public RecordedObservation {
        upstreamLineage = upstreamLineage == null ? List.of() : List.copyOf(upstreamLineage);
    }
}
