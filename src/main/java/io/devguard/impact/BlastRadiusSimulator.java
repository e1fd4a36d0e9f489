package io.devguard.impact;

import io.devguard.engine.AnalysisCancelledException;
import io.devguard.engine.CancellationToken;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.ChangeSpec;
import io.devguard.model.Edge;
import io.devguard.model.ImpactEntry;
import io.devguard.model.ImpactResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Computes the blast radius of a proposed change by walking dependency edges backwards.
 * <p>
 * The traversal is breadth-first and level-synchronous: all nodes at distance
 * {@code d} are expanded before any at {@code d + 1}, and a node is settled at the
 * first level that reaches it, so distance is the shortest propagating path. The
 * confidence of an affected node is the minimum edge confidence along its path; when
 * several same-length paths reach it, the best of those minimums is kept. The
 * visited set makes the walk terminate on cyclic graphs.
 */
public class BlastRadiusSimulator {

    private static final Logger log = LoggerFactory.getLogger(BlastRadiusSimulator.class);

    static final Comparator<ImpactEntry> ENTRY_ORDER = Comparator
            .comparingInt(ImpactEntry::distance)
            .thenComparing(Comparator.comparingDouble(ImpactEntry::confidence).reversed())
            .thenComparing(ImpactEntry::nodeId);

    private final int maxDepth;

    /**
     * @param maxDepth maximum distance to report, 0 for unlimited
     */
    public BlastRadiusSimulator(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Simulates a change.
     *
     * @throws NodeNotFoundException      if the target id is not in the graph
     * @throws AnalysisCancelledException if the token is cancelled during traversal
     */
    public ImpactResult simulate(DependencyGraph graph, long snapshotVersion, ChangeSpec change,
                                 CancellationToken cancellation) throws NodeNotFoundException {
        String targetId = change.targetId();
        if (!graph.containsNode(targetId)) {
            throw new NodeNotFoundException(targetId, snapshotVersion);
        }

        Set<String> visited = new HashSet<>();
        visited.add(targetId);
        Map<String, Double> frontier = Map.of(targetId, 1.0);
        List<ImpactEntry> entries = new ArrayList<>();
        int distance = 0;

        while (!frontier.isEmpty() && (maxDepth == 0 || distance < maxDepth)) {
            distance++;
            Map<String, Double> next = new HashMap<>();
            for (Map.Entry<String, Double> current : frontier.entrySet()) {
                cancellation.throwIfCancelled();
                for (Edge edge : graph.incoming(current.getKey())) {
                    if (visited.contains(edge.sourceId())
                            || !PropagationRules.propagates(change.kind(), edge, targetId)) {
                        continue;
                    }
                    double confidence = Math.min(current.getValue(), edge.confidence());
                    next.merge(edge.sourceId(), confidence, Math::max);
                }
            }
            visited.addAll(next.keySet());
            for (Map.Entry<String, Double> reached : next.entrySet()) {
                entries.add(new ImpactEntry(reached.getKey(), distance, reached.getValue()));
            }
            frontier = next;
        }

        entries.sort(ENTRY_ORDER);
        log.debug("{} of {} affects {} nodes (max distance {})",
                change.kind(), targetId, entries.size(), entries.isEmpty() ? 0 : entries.get(entries.size() - 1).distance());
        return new ImpactResult(change, snapshotVersion, entries);
    }
}
