package io.devguard.detectors;

import io.devguard.config.AnalysisConfig;
import io.devguard.engine.AnalysisCancelledException;
import io.devguard.engine.CancellationToken;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.IntegrityFinding;
import io.devguard.model.IntegrityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs every enabled detector over one graph and assembles the integrity report.
 * <p>
 * Detectors only read the graph, so they are submitted to the executor together.
 * Findings are ordered by kind, then severity (high first), then primary node id,
 * which makes reports for the same snapshot identical regardless of scheduling.
 */
public class IntegrityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(IntegrityAnalyzer.class);

    static final Comparator<IntegrityFinding> FINDING_ORDER = Comparator
            .comparing(IntegrityFinding::kind)
            .thenComparingInt(f -> f.severity().rank())
            .thenComparing(IntegrityFinding::primaryNodeId)
            .thenComparing(f -> f.description() == null ? "" : f.description());

    private final DetectorRegistry registry;
    private final AnalysisConfig config;
    private final Executor executor;
    private final Clock clock;

    public IntegrityAnalyzer(DetectorRegistry registry, AnalysisConfig config, Executor executor) {
        this(registry, config, executor, Clock.systemUTC());
    }

    IntegrityAnalyzer(DetectorRegistry registry, AnalysisConfig config, Executor executor, Clock clock) {
        this.registry = registry;
        this.config = config;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Analyzes a graph.
     *
     * @param graph           snapshot graph
     * @param snapshotVersion version recorded in the report
     * @param cancellation    checked by every detector between node visits
     * @throws AnalysisCancelledException if the token is cancelled before all detectors finish
     */
    public IntegrityReport analyze(DependencyGraph graph, long snapshotVersion, CancellationToken cancellation) {
        Instant start = clock.instant();
        cancellation.throwIfCancelled();

        List<CompletableFuture<List<IntegrityFinding>>> futures = new ArrayList<>();
        for (Detector detector : registry.enabledDetectors(config.detectors().disabled())) {
            futures.add(CompletableFuture.supplyAsync(() -> runDetector(detector, graph, cancellation), executor));
        }

        List<IntegrityFinding> findings = new ArrayList<>();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<List<IntegrityFinding>> future : futures) {
                findings.addAll(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        findings.sort(FINDING_ORDER);

        Duration duration = Duration.between(start, clock.instant());
        log.info("Integrity analysis of snapshot v{}: {} findings, coverage {}%",
                snapshotVersion, findings.size(), Math.round(graph.coverage() * 1000) / 10.0);
        return new IntegrityReport(
                snapshotVersion,
                findings,
                graph.coverage(),
                graph.unparsedFiles(),
                graph.unresolvedReferences().size(),
                start,
                duration);
    }

    private List<IntegrityFinding> runDetector(Detector detector, DependencyGraph graph,
                                               CancellationToken cancellation) {
        List<IntegrityFinding> findings = detector.detect(graph, config, cancellation);
        log.debug("Detector '{}' produced {} findings", detector.id(), findings.size());
        return findings;
    }
}
