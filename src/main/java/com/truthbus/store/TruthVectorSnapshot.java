package com.truthbus.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthbus.contract.ClaimIdentity;
import com.truthbus.contract.ValueKind;
import com.truthbus.state.EpistemicState;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time copy of a truth vector, safe to hand to callers and serialize
 * without holding the vector's lock.
 */
public record TruthVectorSnapshot(
    @JsonProperty("vector_id") String vectorId,
    @JsonProperty("claim") ClaimIdentity claim,
    @JsonProperty("value_kind") ValueKind valueKind,
    @JsonProperty("sources") Set<String> sources,
    @JsonProperty("current_values") Map<String, Object> currentValues,
    @JsonProperty("observations") List<RecordedObservation> observations,
    @JsonProperty("lineage") List<String> lineage,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("contradiction_score") double contradictionScore,
    @JsonProperty("independence_score") double independenceScore,
    @JsonProperty("epistemic_state") EpistemicState epistemicState,
    @JsonProperty("requires_investigation") boolean requiresInvestigation,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public int sourceCount() {
        return sources.size();
    }
}
