package com.truthbus.store;

import com.truthbus.contract.ClaimIdentity;
import com.truthbus.contract.ObservationEnvelope;
import com.truthbus.contract.ObservationValidationException;
import com.truthbus.contract.ObservationValidator;
import com.truthbus.contract.ValueKind;
import com.truthbus.contradiction.ContradictionDetector;
import com.truthbus.contradiction.SpreadContradictionDetector;
import com.truthbus.lineage.AdjacencyMapDependencyGraph;
import com.truthbus.state.ConfidencePolicy;
import com.truthbus.state.ConfidenceProperties;
import com.truthbus.state.EpistemicState;
import com.truthbus.state.EpistemicStateMachine;
import com.truthbus.state.StateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTruthVectorStoreTest {

    private static final ClaimIdentity BTC_CHANGE = new ClaimIdentity("BTC", "price_change_24h", "2026-10-17");
    private static final ClaimIdentity MARKET_MOOD = new ClaimIdentity("market", "sentiment", "2026-10-17");

    private AdjacencyMapDependencyGraph graph;
    private InMemoryTruthVectorStore store;

    @BeforeEach
    void setUp() {
        graph = new AdjacencyMapDependencyGraph();
        store = newStore(graph, Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC));
    }

    static InMemoryTruthVectorStore newStore(AdjacencyMapDependencyGraph graph, Clock clock) {
        EpistemicStateMachine machine = new EpistemicStateMachine(StateProperties.defaults());
        return new InMemoryTruthVectorStore(
            new ObservationValidator(),
            graph,
            new SpreadContradictionDetector(0.25),
            machine,
            new ConfidencePolicy(ConfidenceProperties.defaults(), machine),
            clock
        );
    }

    @Nested
    @DisplayName("Creation and merge")
    class CreationAndMerge {

        @Test
        void firstObservation_createsRawVector() {
            IngestResult result = store.ingest(numeric("A", BTC_CHANGE, 5.2, "X"));

            assertEquals(IngestResult.Outcome.CREATED, result.outcome());
            assertEquals(EpistemicState.RAW_OBSERVATION, result.epistemicState());
            assertEquals(0.5, result.confidence(), 1e-9);
            assertEquals(BTC_CHANGE.vectorId(), result.vectorId());

            TruthVectorSnapshot snapshot = store.find(BTC_CHANGE).orElseThrow();
            assertEquals(1, snapshot.sourceCount());
            assertEquals(0.0, snapshot.contradictionScore());
            assertEquals(0.0, snapshot.independenceScore());
            assertEquals(List.of("OBSERVATION:A"), snapshot.lineage());
            assertEquals(ValueKind.NUMERIC, snapshot.valueKind());
        }

        @Test
        void observationLineage_isRegisteredInGraph() {
            store.ingest(numeric("A", BTC_CHANGE, 5.2, "X"));
            assertTrue(graph.upstreamsOf("A").contains("X"));
        }

        @Test
        void secondSource_isCorroboration() {
            store.ingest(numeric("A", BTC_CHANGE, 5.2, "X"));
            IngestResult result = store.ingest(numeric("B", BTC_CHANGE, 5.2, "Y"));

            assertEquals(IngestResult.Outcome.MERGED, result.outcome());
            assertEquals(EpistemicState.CORROBORATED, result.epistemicState());
            assertEquals(0.7, result.confidence(), 1e-9);
            assertEquals(List.of("OBSERVATION:A", "CORROBORATION:B"), store.find(BTC_CHANGE).orElseThrow().lineage());
        }

        @Test
        void unknownClaim_isEmpty() {
            assertTrue(store.find(new ClaimIdentity("nope", "nope", "nope")).isEmpty());
        }

        @Test
        void differentClaims_areUnrelated() {
            store.ingest(numeric("A", BTC_CHANGE, 5.2, "X"));
            store.ingest(categorical("A", MARKET_MOOD, "bullish"));
            assertEquals(2, store.size());
            assertEquals(1, store.find(BTC_CHANGE).orElseThrow().sourceCount());
        }
    }

    @Nested
    @DisplayName("Duplicates and revisions")
    class DuplicatesAndRevisions {

        @Test
        void identicalRepeat_isNoOp() {
            store.ingest(numeric("A", BTC_CHANGE, 5.2, "X"));
            store.ingest(numeric("B", BTC_CHANGE, 5.3, "Y"));
            TruthVectorSnapshot before = store.find(BTC_CHANGE).orElseThrow();

            IngestResult result = store.ingest(numeric("B", BTC_CHANGE, 5.3, "Y"));

            TruthVectorSnapshot after = store.find(BTC_CHANGE).orElseThrow();
            assertEquals(IngestResult.Outcome.DUPLICATE, result.outcome());
            assertEquals(before.sourceCount(), after.sourceCount());
            assertEquals(before.contradictionScore(), after.contradictionScore());
            assertEquals(before.confidence(), after.confidence());
            assertEquals(before.observations().size(), after.observations().size());
        }

        @Test
        void integerRepeatOfDouble_isStillDuplicate() {
            store.ingest(numeric("A", BTC_CHANGE, 5.0, "X"));
            assertEquals(IngestResult.Outcome.DUPLICATE, store.ingest(numeric("A", BTC_CHANGE, 5, "X")).outcome());
        }

        @Test
        void revisedValue_replacesContributionButKeepsSourceCount() {
            store.ingest(numeric("A", BTC_CHANGE, 5.2, "X"));
            store.ingest(numeric("B", BTC_CHANGE, 9.0, "Y"));
            assertEquals(EpistemicState.DISPUTED, store.find(BTC_CHANGE).orElseThrow().epistemicState());

            IngestResult result = store.ingest(numeric("B", BTC_CHANGE, 5.2, "Y"));

            TruthVectorSnapshot snapshot = store.find(BTC_CHANGE).orElseThrow();
            assertEquals(IngestResult.Outcome.MERGED, result.outcome());
            assertEquals(2, snapshot.sourceCount());
            assertEquals(3, snapshot.observations().size());
            assertEquals(0.0, snapshot.contradictionScore());
            assertEquals(EpistemicState.CORROBORATED, snapshot.epistemicState());
            assertEquals("REVISION:B", snapshot.lineage().get(2));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void missingTimestamp_leavesVectorUnchanged() {
            store.ingest(numeric("A", BTC_CHANGE, 5.2, "X"));
            ObservationEnvelope bad = numeric("B", BTC_CHANGE, 5.2, "Y");
            bad.setTimestamp(null);

            assertThrows(ObservationValidationException.class, () -> store.ingest(bad));

            TruthVectorSnapshot snapshot = store.find(BTC_CHANGE).orElseThrow();
            assertEquals(1, snapshot.sourceCount());
            assertFalse(graph.upstreamsOf("B").contains("Y"));
        }

        @Test
        void kindMismatch_isRejected() {
            store.ingest(numeric("A", BTC_CHANGE, 5.2, "X"));
            ObservationEnvelope wrongKind = categorical("B", BTC_CHANGE, "up");

            assertThrows(ObservationValidationException.class, () -> store.ingest(wrongKind));
            assertEquals(1, store.find(BTC_CHANGE).orElseThrow().observations().size());
        }

        @Test
        void invalidFirstObservation_createsNoVector() {
            ObservationEnvelope bad = numeric("A", BTC_CHANGE, 5.2, "X");
            bad.setValue("five");
            assertThrows(ObservationValidationException.class, () -> store.ingest(bad));
            assertTrue(store.find(BTC_CHANGE).isEmpty());
            assertEquals(0, store.size());
        }

        @Test
        void outOfRangeScore_leavesVectorUnchanged() {
            ContradictionDetector brokenOnThird = (kind, values) -> values.size() >= 3 ? Double.NaN : 0.0;
            EpistemicStateMachine machine = new EpistemicStateMachine(StateProperties.defaults());
            InMemoryTruthVectorStore guarded = new InMemoryTruthVectorStore(new ObservationValidator(), graph,
                brokenOnThird, machine, new ConfidencePolicy(ConfidenceProperties.defaults(), machine),
                Clock.systemUTC());

            guarded.ingest(numeric("A", BTC_CHANGE, 1.7e308, "X"));
            guarded.ingest(numeric("B", BTC_CHANGE, 1.7e308, "Y"));
            TruthVectorSnapshot before = guarded.find(BTC_CHANGE).orElseThrow();

            assertThrows(InvariantViolationException.class,
                () -> guarded.ingest(numeric("C", BTC_CHANGE, -1.7e308, "Z")));

            TruthVectorSnapshot after = guarded.find(BTC_CHANGE).orElseThrow();
            assertEquals(2, after.sourceCount());
            assertEquals(2, after.observations().size());
            assertEquals(List.of("OBSERVATION:A", "CORROBORATION:B"), after.lineage());
            assertEquals(EpistemicState.CORROBORATED, after.epistemicState());
            assertEquals(before.confidence(), after.confidence());
            assertEquals(before.updatedAt(), after.updatedAt());
        }

        @Test
        void outOfRangeScoreOnFirstObservation_createsNoVector() {
            ContradictionDetector broken = (kind, values) -> -0.5;
            EpistemicStateMachine machine = new EpistemicStateMachine(StateProperties.defaults());
            InMemoryTruthVectorStore guarded = new InMemoryTruthVectorStore(new ObservationValidator(), graph,
                broken, machine, new ConfidencePolicy(ConfidenceProperties.defaults(), machine),
                Clock.systemUTC());

            assertThrows(InvariantViolationException.class,
                () -> guarded.ingest(numeric("A", BTC_CHANGE, 5.2, "X")));
            assertTrue(guarded.find(BTC_CHANGE).isEmpty());
            assertEquals(0, guarded.size());
        }
    }

    @Test
    @DisplayName("Sources disagreeing near the double range limit are disputed")
    void extremeMagnitudes_disagreementIsDisputed() {
        store.ingest(numeric("A", BTC_CHANGE, 1.7e308, "X"));
        store.ingest(numeric("B", BTC_CHANGE, 1.7e308, "Y"));
        store.ingest(numeric("C", BTC_CHANGE, -1.7e308, "Z"));

        TruthVectorSnapshot snapshot = store.find(BTC_CHANGE).orElseThrow();
        assertEquals(3, snapshot.sourceCount());
        assertEquals(1.0, snapshot.contradictionScore());
        assertEquals(EpistemicState.DISPUTED, snapshot.epistemicState());
    }

    @Test
    @DisplayName("Categorical claims score disagreement against the majority")
    void categoricalClaim_disagreementIsAnomalous() {
        store.ingest(categorical("A", MARKET_MOOD, "bullish"));
        store.ingest(categorical("B", MARKET_MOOD, "bullish"));
        store.ingest(categorical("C", MARKET_MOOD, "bearish"));

        TruthVectorSnapshot snapshot = store.find(MARKET_MOOD).orElseThrow();
        assertEquals(1.0 / 3.0, snapshot.contradictionScore(), 1e-9);
        assertEquals(EpistemicState.ANOMALOUS, snapshot.epistemicState());
        assertTrue(snapshot.requiresInvestigation());
    }

    @Test
    @DisplayName("Scores stay in [0,1] through an arbitrary ingest sequence")
    void scores_alwaysWithinUnitInterval() {
        double[] values = {5.2, 5.2, 5.3, 80.0, 5.25, -3.0, 5.2, 0.0};
        for (int i = 0; i < values.length; i++) {
            store.ingest(numeric("src-" + (i % 5), BTC_CHANGE, values[i], "up-" + (i % 2)));
            TruthVectorSnapshot snapshot = store.find(BTC_CHANGE).orElseThrow();
            assertInUnit(snapshot.confidence());
            assertInUnit(snapshot.contradictionScore());
            assertInUnit(snapshot.independenceScore());
        }
    }

    @Test
    @DisplayName("Concurrent ingestion keeps per-claim merges atomic")
    void concurrentIngestion_isSerializedPerClaim() throws Exception {
        int producers = 8;
        int claims = 20;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                String source = "agent-" + p;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int c = 0; c < claims; c++) {
                        ClaimIdentity claim = new ClaimIdentity("asset-" + c, "price", "2026-10-17");
                        store.ingest(numeric(source, claim, 100.0, "own-" + source));
                        store.ingest(numeric(source, claim, 100.0, "own-" + source));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(claims, store.size());
        store.snapshots().forEach(snapshot -> {
            assertEquals(producers, snapshot.sourceCount());
            assertEquals(producers, snapshot.observations().size());
            assertEquals(EpistemicState.ARCHETYPAL, snapshot.epistemicState());
            assertEquals(1.0, snapshot.independenceScore(), 1e-9);
        });
    }

    private static void assertInUnit(double score) {
        assertTrue(score >= 0.0 && score <= 1.0, "score out of range: " + score);
    }

    static ObservationEnvelope numeric(String source, ClaimIdentity claim, Number value, String upstream) {
        return new ObservationEnvelope(source, claim, value, ValueKind.NUMERIC,
            Instant.parse("2026-10-17T11:59:00Z"), List.of(upstream));
    }

    static ObservationEnvelope categorical(String source, ClaimIdentity claim, String value) {
        return new ObservationEnvelope(source, claim, value, ValueKind.CATEGORICAL,
            Instant.parse("2026-10-17T11:59:00Z"), List.of());
    }
}
