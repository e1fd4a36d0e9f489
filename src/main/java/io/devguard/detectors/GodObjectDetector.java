package io.devguard.detectors;

import io.devguard.config.AnalysisConfig;
import io.devguard.engine.CancellationToken;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.Edge;
import io.devguard.model.EdgeKind;
import io.devguard.model.FindingKind;
import io.devguard.model.IntegrityFinding;
import io.devguard.model.Node;
import io.devguard.model.Severity;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Detects nodes whose coupling is far above the graph average.
 * <p>
 * Degree is in-degree plus out-degree over Imports, Calls and ReferencesSchema
 * edges. A node is flagged when its degree exceeds
 * {@code max(meanMultiplier * meanDegree, minimumDegree)}; severity is set by the
 * ratio of degree to that threshold.
 */
public class GodObjectDetector implements Detector {

    private static final Set<EdgeKind> COUPLING_EDGES =
            EnumSet.of(EdgeKind.IMPORTS, EdgeKind.CALLS, EdgeKind.REFERENCES_SCHEMA);

    @Override
    public String id() {
        return "god-object";
    }

    @Override
    public String description() {
        return "Detects nodes with excessive coupling";
    }

    @Override
    public FindingKind kind() {
        return FindingKind.GOD_OBJECT;
    }

    @Override
    public List<IntegrityFinding> detect(DependencyGraph graph, AnalysisConfig config,
                                         CancellationToken cancellation) {
        if (graph.nodeCount() == 0) {
            return List.of();
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, Integer> outDegree = new HashMap<>();
        int couplingEdges = 0;
        for (Edge edge : graph.edges()) {
            if (COUPLING_EDGES.contains(edge.kind())) {
                outDegree.merge(edge.sourceId(), 1, Integer::sum);
                inDegree.merge(edge.targetId(), 1, Integer::sum);
                couplingEdges++;
            }
        }

        double meanDegree = 2.0 * couplingEdges / graph.nodeCount();
        AnalysisConfig.GodObject settings = config.godObject();
        double threshold = settings.thresholdFor(meanDegree);

        List<IntegrityFinding> findings = new ArrayList<>();
        for (Node node : graph.nodes()) {
            cancellation.throwIfCancelled();
            int in = inDegree.getOrDefault(node.id(), 0);
            int out = outDegree.getOrDefault(node.id(), 0);
            int degree = in + out;
            if (degree <= threshold) {
                continue;
            }
            double ratio = degree / threshold;
            findings.add(IntegrityFinding.builder()
                    .kind(FindingKind.GOD_OBJECT)
                    .severity(severityFor(ratio, settings))
                    .nodeId(node.id())
                    .matchedPattern(String.format(Locale.ROOT, "degree %d > threshold %.1f", degree, threshold))
                    .description(String.format(Locale.ROOT,
                            "%s %s has degree %d (%d in, %d out), %.1fx the threshold of %.1f (mean degree %.2f)",
                            node.kind().displayName(), node.qualifiedName(), degree, in, out,
                            ratio, threshold, meanDegree))
                    .detectorId(id())
                    .location(node.location())
                    .build());
        }
        return findings;
    }

    static Severity severityFor(double ratio, AnalysisConfig.GodObject settings) {
        if (ratio >= settings.highRatio()) {
            return Severity.HIGH;
        }
        if (ratio >= settings.mediumRatio()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
