package com.truthbus.store;

import com.truthbus.contract.ClaimIdentity;
import com.truthbus.contract.ValueKind;
import com.truthbus.state.EpistemicState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate record for one claim identity.
 *
 * Not thread-safe. Every access goes through the owning store's per-claim lock;
 * callers outside the store only ever see {@link TruthVectorSnapshot}s.
 */
class TruthVector {

    private final String vectorId;
    private final ClaimIdentity claim;
    private final ValueKind valueKind;
    private final Instant createdAt;

    private final Set<String> sources = new LinkedHashSet<>();
    private final Map<String, Object> currentValues = new LinkedHashMap<>();
    private final List<RecordedObservation> observations = new ArrayList<>();
    private final List<String> lineage = new ArrayList<>();

    private double confidence;
    private double contradictionScore;
    private double independenceScore;
    private EpistemicState epistemicState = EpistemicState.RAW_OBSERVATION;
    private boolean requiresInvestigation;
    private Instant updatedAt;

    TruthVector(ClaimIdentity claim, ValueKind valueKind, double baselineConfidence, Instant createdAt) {
        this.vectorId = claim.vectorId();
        this.claim = claim;
        this.valueKind = valueKind;
        this.confidence = baselineConfidence;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * Appends the observation and makes its value the source's current contribution.
     */
    void append(RecordedObservation observation) {
        String source = observation.sourceId();
        if (observations.isEmpty()) {
            lineage.add("OBSERVATION:" + source);
        } else if (sources.contains(source)) {
            lineage.add("REVISION:" + source);
        } else {
            lineage.add("CORROBORATION:" + source);
        }
        observations.add(observation);
        sources.add(source);
        currentValues.put(source, observation.value());
    }

    /**
     * Source set as it would be after accepting an observation from the source.
     */
    Set<String> sourcesWith(String sourceId) {
        Set<String> candidate = new LinkedHashSet<>(sources);
        candidate.add(sourceId);
        return candidate;
    }

    /**
     * Current contributions as they would be after the source reports the value.
     */
    List<Object> valuesWith(String sourceId, Object value) {
        Map<String, Object> candidate = new LinkedHashMap<>(currentValues);
        candidate.put(sourceId, value);
        return new ArrayList<>(candidate.values());
    }

    boolean isDuplicate(String sourceId, Object value) {
        return sources.contains(sourceId) && value.equals(currentValues.get(sourceId));
    }

    void applyScores(double contradictionScore, double independenceScore, EpistemicState state,
                     double confidence, boolean requiresInvestigation, Instant updatedAt) {
        this.contradictionScore = contradictionScore;
        this.independenceScore = independenceScore;
        this.epistemicState = state;
        this.confidence = confidence;
        this.requiresInvestigation = requiresInvestigation;
        this.updatedAt = updatedAt;
    }

    String vectorId() {
        return vectorId;
    }

    ClaimIdentity claim() {
        return claim;
    }

    ValueKind valueKind() {
        return valueKind;
    }

    Set<String> sources() {
        return Collections.unmodifiableSet(sources);
    }

    List<Object> currentValues() {
        return new ArrayList<>(currentValues.values());
    }

    double confidence() {
        return confidence;
    }

    EpistemicState epistemicState() {
        return epistemicState;
    }

    TruthVectorSnapshot snapshot() {
        return new TruthVectorSnapshot(
            vectorId,
            claim,
            valueKind,
            Collections.unmodifiableSet(new LinkedHashSet<>(sources)),
            Collections.unmodifiableMap(new LinkedHashMap<>(currentValues)),
            List.copyOf(observations),
            List.copyOf(lineage),
            confidence,
            contradictionScore,
            independenceScore,
            epistemicState,
            requiresInvestigation,
            createdAt,
            updatedAt
        );
    }
}
