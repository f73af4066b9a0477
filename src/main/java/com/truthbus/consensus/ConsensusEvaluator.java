package com.truthbus.consensus;

import com.truthbus.state.EpistemicState;
import com.truthbus.store.TruthVectorSnapshot;
import com.truthbus.store.TruthVectorStore;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Read-only view over vectors that have reached ARCHETYPAL.
 *
 * Each vector is snapshotted under its own lock and released immediately, so
 * evaluation never holds up ingestion for longer than one copy.
 */
@Service
public class ConsensusEvaluator {

    static final Comparator<TruthVectorSnapshot> CONSENSUS_ORDER =
        Comparator.comparingDouble(TruthVectorSnapshot::confidence).reversed()
            .thenComparing(TruthVectorSnapshot::updatedAt, Comparator.reverseOrder());

    private final TruthVectorStore store;

    public ConsensusEvaluator(TruthVectorStore store) {
        this.store = store;
    }

    /**
     * ARCHETYPAL vectors, highest confidence first, then most recently updated.
     * Nothing is read until the stream is consumed.
     */
    public Stream<TruthVectorSnapshot> consensusVectors() {
        return store.snapshots()
            .filter(v -> v.epistemicState() == EpistemicState.ARCHETYPAL)
            .sorted(CONSENSUS_ORDER);
    }
}
