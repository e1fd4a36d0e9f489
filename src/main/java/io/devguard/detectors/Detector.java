package io.devguard.detectors;

import io.devguard.config.AnalysisConfig;
import io.devguard.engine.CancellationToken;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.FindingKind;
import io.devguard.model.IntegrityFinding;

import java.util.List;

/**
 * Base interface for all integrity detectors.
 * Each detector inspects a graph snapshot for one category of architectural smell.
 * Detectors are read-only and may run concurrently over the same snapshot.
 */
public interface Detector {

    /**
     * Returns a unique identifier for this detector.
     */
    String id();

    /**
     * Returns a human-readable description of what this detector finds.
     */
    String description();

    FindingKind kind();

    /**
     * Detects issues in the given graph.
     *
     * @param graph        the snapshot graph to analyze
     * @param config       thresholds and patterns
     * @param cancellation checked between node visits
     * @return findings from this detector, in a deterministic order
     */
    List<IntegrityFinding> detect(DependencyGraph graph, AnalysisConfig config, CancellationToken cancellation);
}
