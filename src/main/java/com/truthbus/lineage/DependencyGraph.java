package com.truthbus.lineage;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Registry of which source derives its data from which upstream provider.
 *
 * The internal representation is an implementation choice; callers only see
 * lineage registration and the scores computed over it.
 */
public interface DependencyGraph {

    /**
     * Registers or merges the upstream set for a source. Idempotent union.
     */
    void recordLineage(String sourceId, Collection<String> upstreamIds);

    /**
     * Every provider reachable from the source through registered edges,
     * excluding the source itself. Unknown sources have no upstreams.
     */
    Set<String> upstreamsOf(String sourceId);

    /**
     * {@code 1 - sharedPairs / totalPairs} over all unordered pairs, or 0.0
     * when fewer than two sources are given.
     */
    double independenceScore(Collection<String> sourceIds);

    /**
     * Pairs of registered sources whose upstream sets overlap with a Jaccard
     * similarity above the threshold, most similar first.
     */
    List<SourceConvergence> findHiddenConvergences(double threshold);
}
