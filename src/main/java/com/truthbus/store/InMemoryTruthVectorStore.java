package com.truthbus.store;

import com.truthbus.contract.ClaimIdentity;
import com.truthbus.contract.ObservationEnvelope;
import com.truthbus.contract.ObservationValidator;
import com.truthbus.contradiction.ContradictionDetector;
import com.truthbus.lineage.DependencyGraph;
import com.truthbus.state.ConfidencePolicy;
import com.truthbus.state.EpistemicState;
import com.truthbus.state.EpistemicStateMachine;
import com.truthbus.state.Evidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * In-memory truth vector store sharded by claim identity.
 *
 * Each claim owns a slot with its own lock. A slot stays empty when scoring
 * the claim's first observation failed, so readers treat an empty slot as
 * "never observed". A rejected observation leaves the vector untouched. No
 * code path ever holds two slot locks at once.
 */
@Component
public class InMemoryTruthVectorStore implements TruthVectorStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTruthVectorStore.class);

    private final ConcurrentHashMap<ClaimIdentity, Slot> slots = new ConcurrentHashMap<>();

    private final ObservationValidator validator;
    private final DependencyGraph dependencyGraph;
    private final ContradictionDetector contradictionDetector;
    private final EpistemicStateMachine stateMachine;
    private final ConfidencePolicy confidencePolicy;
    private final Clock clock;

    public InMemoryTruthVectorStore(ObservationValidator validator,
                                    DependencyGraph dependencyGraph,
                                    ContradictionDetector contradictionDetector,
                                    EpistemicStateMachine stateMachine,
                                    ConfidencePolicy confidencePolicy,
                                    Clock clock) {
        this.validator = validator;
        this.dependencyGraph = dependencyGraph;
        this.contradictionDetector = contradictionDetector;
        this.stateMachine = stateMachine;
        this.confidencePolicy = confidencePolicy;
        this.clock = clock;
    }

    @Override
    public IngestResult ingest(ObservationEnvelope observation) {
        validator.validate(observation);
        Object value = validator.canonicalValue(observation);
        ClaimIdentity claim = observation.getClaim();

        Slot slot = slots.computeIfAbsent(claim, k -> new Slot());
        slot.lock.lock();
        try {
            TruthVector vector = slot.vector;
            if (vector != null) {
                validator.validateKind(observation, vector.valueKind());
                if (vector.isDuplicate(observation.getSourceId(), value)) {
                    log.debug("Duplicate observation ignored: claim={}, source={}",
                        claim, observation.getSourceId());
                    return new IngestResult(vector.vectorId(), vector.epistemicState(),
                        vector.confidence(), IngestResult.Outcome.DUPLICATE);
                }
            }

            Instant now = clock.instant();
            IngestResult.Outcome outcome = IngestResult.Outcome.MERGED;
            if (vector == null) {
                vector = new TruthVector(claim, observation.getValueKind(),
                    confidencePolicy.confidence(EpistemicState.RAW_OBSERVATION, new Evidence(1, 0.0, 0.0)),
                    now);
                outcome = IngestResult.Outcome.CREATED;
                log.debug("Truth vector created: claim={}, vector_id={}", claim, vector.vectorId());
            }

            dependencyGraph.recordLineage(observation.getSourceId(), observation.getUpstreamLineage());

            // Scores are computed over the candidate state first; the vector is
            // only touched once every score has passed its range check.
            Scores scores = score(vector, observation.getSourceId(), value);

            EpistemicState previous = vector.epistemicState();
            vector.append(new RecordedObservation(
                observation.getSourceId(),
                value,
                observation.getValueKind(),
                observation.getTimestamp(),
                observation.getUpstreamLineage(),
                now
            ));
            vector.applyScores(scores.contradiction(), scores.independence(), scores.state(),
                scores.confidence(), scores.requiresInvestigation(), now);
            slot.vector = vector;

            if (previous != vector.epistemicState()) {
                log.info("Epistemic transition claim={} {} -> {} (sources={}, confidence={})",
                    claim, previous, vector.epistemicState(), vector.sources().size(), vector.confidence());
            }
            return new IngestResult(vector.vectorId(), vector.epistemicState(), vector.confidence(), outcome);
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public Optional<TruthVectorSnapshot> find(ClaimIdentity claim) {
        Slot slot = slots.get(claim);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.snapshot());
    }

    @Override
    public Stream<TruthVectorSnapshot> snapshots() {
        return slots.values().stream()
            .map(Slot::snapshot)
            .filter(Objects::nonNull);
    }

    @Override
    public int size() {
        return (int) slots.values().stream().filter(slot -> slot.snapshot() != null).count();
    }

    private Scores score(TruthVector vector, String sourceId, Object value) {
        Set<String> sources = vector.sourcesWith(sourceId);
        double contradiction = contradictionDetector.score(vector.valueKind(), vector.valuesWith(sourceId, value));
        double independence = dependencyGraph.independenceScore(sources);
        requireUnit("contradiction_score", contradiction, vector);
        requireUnit("independence_score", independence, vector);

        Evidence evidence = new Evidence(sources.size(), contradiction, independence);
        EpistemicState state = stateMachine.transition(evidence);
        double confidence = confidencePolicy.confidence(state, evidence);
        requireUnit("confidence", confidence, vector);

        return new Scores(contradiction, independence, state, confidence,
            stateMachine.requiresInvestigation(state, contradiction, confidence));
    }

    private void requireUnit(String name, double score, TruthVector vector) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            String message = name + " out of range [0,1]: " + score + " for claim " + vector.claim();
            log.error("Invariant violation: {}", message);
            throw new InvariantViolationException(message);
        }
    }

    private record Scores(double contradiction, double independence, EpistemicState state,
                          double confidence, boolean requiresInvestigation) {}

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private TruthVector vector;

        TruthVectorSnapshot snapshot() {
            lock.lock();
            try {
                return vector == null ? null : vector.snapshot();
            } finally {
                lock.unlock();
            }
        }
    }
}
