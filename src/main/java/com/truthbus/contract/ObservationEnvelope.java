package com.truthbus.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound observation as submitted by a data-collection agent.
 *
 * Mutable for deserialization only; once accepted by the store it is
 * converted into an immutable {@link com.truthbus.store.RecordedObservation}.
 */
public class ObservationEnvelope {

    @JsonProperty("source_id")
    private String sourceId;

    @JsonProperty("claim")
    private ClaimIdentity claim;

    @JsonProperty("value")
    private Object value;

    @JsonProperty("value_kind")
    private ValueKind valueKind;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("upstream_lineage")
    private List<String> upstreamLineage = new ArrayList<>();

    public ObservationEnvelope() {
    }

    public ObservationEnvelope(String sourceId, ClaimIdentity claim, Object value,
                               ValueKind valueKind, Instant timestamp, List<String> upstreamLineage) {
        this.sourceId = sourceId;
        this.claim = claim;
        this.value = value;
        this.valueKind = valueKind;
        this.timestamp = timestamp;
        this.upstreamLineage = upstreamLineage;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public ClaimIdentity getClaim() {
        return claim;
    }

    public void setClaim(ClaimIdentity claim) {
        this.claim = claim;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public ValueKind getValueKind() {
        return valueKind;
    }

    public void setValueKind(ValueKind valueKind) {
        this.valueKind = valueKind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public List<String> getUpstreamLineage() {
        return upstreamLineage;
    }

    public void setUpstreamLineage(List<String> upstreamLineage) {
        this.upstreamLineage = upstreamLineage;
    }
}
