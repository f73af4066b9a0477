package com.truthbus.store;

import com.truthbus.contract.ClaimIdentity;
import com.truthbus.contract.ObservationEnvelope;

import java.util.Optional;
import java.util.stream.Stream;

public interface TruthVectorStore {

    /**
     * Merges an observation into the vector for its claim identity, creating
     * the vector on first sight. Mutations of the same claim are serialized;
     * different claims never block each other.
     *
     * @throws com.truthbus.contract.ObservationValidationException if the observation is malformed
     */
    IngestResult ingest(ObservationEnvelope observation);

    Optional<TruthVectorSnapshot> find(ClaimIdentity claim);

    /**
     * Lazily snapshots every vector, one consistent read per vector.
     */
    Stream<TruthVectorSnapshot> snapshots();

    int size();
}
