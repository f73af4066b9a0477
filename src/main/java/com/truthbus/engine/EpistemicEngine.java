package com.truthbus.engine;

import com.truthbus.consensus.ConsensusEvaluator;
import com.truthbus.contract.ClaimIdentity;
import com.truthbus.contract.ObservationEnvelope;
import com.truthbus.contract.ObservationValidator;
import com.truthbus.lineage.DependencyGraph;
import com.truthbus.lineage.SourceConvergence;
import com.truthbus.state.EpistemicState;
import com.truthbus.store.IngestResult;
import com.truthbus.store.TruthVectorSnapshot;
import com.truthbus.store.TruthVectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry point for data-collection agents and report generators.
 *
 * One instance owns one store and one dependency graph; construct as many as
 * needed, nothing here is process-global.
 */
@Service
public class EpistemicEngine {

    private static final Logger log = LoggerFactory.getLogger(EpistemicEngine.class);

    private final ObservationValidator validator;
    private final TruthVectorStore store;
    private final DependencyGraph dependencyGraph;
    private final ConsensusEvaluator consensusEvaluator;

    public EpistemicEngine(ObservationValidator validator,
                           TruthVectorStore store,
                           DependencyGraph dependencyGraph,
                           ConsensusEvaluator consensusEvaluator) {
        this.validator = validator;
        this.store = store;
        this.dependencyGraph = dependencyGraph;
        this.consensusEvaluator = consensusEvaluator;
    }

    public IngestResult ingest(ObservationEnvelope observation) {
        IngestResult result = store.ingest(observation);
        log.debug("Ingested observation source={} claim={} outcome={} state={}",
            observation.getSourceId(), observation.getClaim(), result.outcome(), result.epistemicState());
        return result;
    }

    public void recordLineage(String sourceId, Collection<String> upstreamIds) {
        validator.validateSourceId(sourceId);
        validator.validateSourceIds(upstreamIds, "upstream_ids");
        dependencyGraph.recordLineage(sourceId, upstreamIds);
        log.info("Lineage recorded for source={} upstreams={}", sourceId, upstreamIds);
    }

    public Optional<TruthVectorSnapshot> getVector(ClaimIdentity claim) {
        return store.find(claim);
    }

    /**
     * All vectors, or only those in the given state, oldest first.
     */
    public List<TruthVectorSnapshot> vectors(Optional<EpistemicState> state, int limit) {
        return store.snapshots()
            .filter(v -> state.map(s -> s == v.epistemicState()).orElse(true))
            .sorted(Comparator.comparing(TruthVectorSnapshot::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    public Stream<TruthVectorSnapshot> consensusVectors() {
        return consensusEvaluator.consensusVectors();
    }

    public double independenceScore(Collection<String> sourceIds) {
        validator.validateSourceIds(sourceIds, "source_ids");
        return dependencyGraph.independenceScore(sourceIds);
    }

    public List<SourceConvergence> hiddenConvergences(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0,1]");
        }
        return dependencyGraph.findHiddenConvergences(threshold);
    }
}
