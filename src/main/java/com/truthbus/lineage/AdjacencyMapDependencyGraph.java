package com.truthbus.lineage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dependency graph backed by a concurrent adjacency map (node -> direct upstreams).
 *
 * Writes are rare relative to reads, so registration only ever adds edges and
 * never takes a lock beyond the map's own. Upstream resolution is transitive and
 * tolerates cycles.
 */
public class AdjacencyMapDependencyGraph implements DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(AdjacencyMapDependencyGraph.class);

    private final Map<String, Set<String>> adjacency = new ConcurrentHashMap<>();

    @Override
    public void recordLineage(String sourceId, Collection<String> upstreamIds) {
        Set<String> direct = adjacency.computeIfAbsent(sourceId, k -> ConcurrentHashMap.newKeySet());
        if (upstreamIds == null) {
            return;
        }
        for (String upstream : upstreamIds) {
            if (upstream.equals(sourceId)) {
                continue;
            }
            adjacency.computeIfAbsent(upstream, k -> ConcurrentHashMap.newKeySet());
            if (direct.add(upstream)) {
                log.debug("Lineage edge registered: {} -> {}", sourceId, upstream);
            }
        }
    }

    @Override
    public Set<String> upstreamsOf(String sourceId) {
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>(adjacency.getOrDefault(sourceId, Set.of()));
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (String next : adjacency.getOrDefault(current, Set.of())) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        visited.remove(sourceId);
        return visited;
    }

    @Override
    public double independenceScore(Collection<String> sourceIds) {
        if (sourceIds == null || sourceIds.size() < 2) {
            return 0.0;
        }

        List<String> sources = new ArrayList<>(sourceIds);
        List<Set<String>> upstreams = new ArrayList<>(sources.size());
        for (String source : sources) {
            upstreams.add(upstreamsOf(source));
        }

        int totalPairs = 0;
        int sharedPairs = 0;
        for (int i = 0; i < sources.size(); i++) {
            for (int j = i + 1; j < sources.size(); j++) {
                totalPairs++;
                if (isSharedPair(sources.get(i), upstreams.get(i), sources.get(j), upstreams.get(j))) {
                    sharedPairs++;
                }
            }
        }

        return 1.0 - ((double) sharedPairs / totalPairs);
    }

    @Override
    public List<SourceConvergence> findHiddenConvergences(double threshold) {
        List<String> sources = new ArrayList<>(new TreeSet<>(adjacency.keySet()));
        List<SourceConvergence> convergences = new ArrayList<>();

        for (int i = 0; i < sources.size(); i++) {
            Set<String> upstreamA = upstreamsOf(sources.get(i));
            if (upstreamA.isEmpty()) {
                continue;
            }
            for (int j = i + 1; j < sources.size(); j++) {
                Set<String> upstreamB = upstreamsOf(sources.get(j));
                if (upstreamB.isEmpty()) {
                    continue;
                }

                Set<String> shared = new TreeSet<>(upstreamA);
                shared.retainAll(upstreamB);
                Set<String> union = new LinkedHashSet<>(upstreamA);
                union.addAll(upstreamB);

                double jaccard = (double) shared.size() / union.size();
                if (jaccard > threshold) {
                    convergences.add(new SourceConvergence(sources.get(i), sources.get(j), jaccard, shared));
                }
            }
        }

        convergences.sort(Comparator.comparingDouble(SourceConvergence::jaccard).reversed());
        return convergences;
    }

    private boolean isSharedPair(String a, Set<String> upstreamA, String b, Set<String> upstreamB) {
        if (a.equals(b)) {
            return true;
        }
        if (upstreamA.contains(b) || upstreamB.contains(a)) {
            return true;
        }
        for (String upstream : upstreamA) {
            if (upstreamB.contains(upstream)) {
                return true;
            }
        }
        return false;
    }
}
