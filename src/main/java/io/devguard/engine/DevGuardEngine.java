package io.devguard.engine;

import io.devguard.config.AnalysisConfig;
import io.devguard.detectors.DetectorRegistry;
import io.devguard.detectors.IntegrityAnalyzer;
import io.devguard.detectors.RiskScanner;
import io.devguard.extract.ExtractionOutcome;
import io.devguard.extract.ExtractorRegistry;
import io.devguard.extract.FileContribution;
import io.devguard.graph.DependencyGraph;
import io.devguard.graph.GraphBuilder;
import io.devguard.graph.Snapshot;
import io.devguard.graph.SnapshotLease;
import io.devguard.graph.SnapshotStore;
import io.devguard.impact.BlastRadiusSimulator;
import io.devguard.impact.NodeNotFoundException;
import io.devguard.model.ChangeSpec;
import io.devguard.model.ImpactResult;
import io.devguard.model.IntegrityReport;
import io.devguard.model.NodeIds;
import io.devguard.model.SourceDocument;
import io.devguard.model.UnparsedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the analysis core.
 * <p>
 * {@link #ingest} validates a batch, extracts every document on a bounded worker pool,
 * merges the contributions on the calling thread and publishes the result as a new
 * snapshot. Ingestions are serialized; reads ({@link #analyze}, {@link #simulate})
 * never wait for them and always see one complete snapshot version. Detectors run on
 * their own pool so that queued extraction work cannot delay an analysis.
 */
public class DevGuardEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DevGuardEngine.class);

    private final AnalysisConfig config;
    private final ExtractorRegistry extractors;
    private final RiskScanner riskScanner;
    private final GraphBuilder graphBuilder;
    private final IntegrityAnalyzer analyzer;
    private final BlastRadiusSimulator simulator;
    private final SnapshotStore store = new SnapshotStore();
    private final ExecutorService executor;
    private final ExecutorService detectorExecutor;
    private final Object ingestLock = new Object();

    public DevGuardEngine(AnalysisConfig config) {
        this(config, ExtractorRegistry.createDefault(), DetectorRegistry.createDefault());
    }

    public DevGuardEngine(AnalysisConfig config, ExtractorRegistry extractors, DetectorRegistry detectors) {
        this.config = config;
        this.extractors = extractors;
        this.riskScanner = new RiskScanner(config.productionRisk());
        this.graphBuilder = new GraphBuilder(config);
        this.executor = Executors.newFixedThreadPool(
                config.extraction().effectiveParallelism(), threads("devguard-worker-"));
        this.detectorExecutor = Executors.newFixedThreadPool(
                Math.max(1, detectors.allDetectors().size()), threads("devguard-detector-"));
        this.analyzer = new IntegrityAnalyzer(detectors, config, detectorExecutor);
        this.simulator = new BlastRadiusSimulator(config.impact().maxDepth());
    }

    public IngestionSummary ingest(List<SourceDocument> documents) throws ValidationException {
        return ingest(documents, CancellationToken.none());
    }

    /**
     * Builds a new graph from a complete batch and publishes it as the current snapshot.
     *
     * @throws ValidationException        if the batch is malformed; nothing is published
     * @throws AnalysisCancelledException if cancelled before publishing; nothing is published
     */
    public IngestionSummary ingest(List<SourceDocument> documents, CancellationToken cancellation)
            throws ValidationException {
        List<SourceDocument> batch = validate(documents);
        synchronized (ingestLock) {
            Instant start = Instant.now();
            log.info("Ingesting {} documents", batch.size());

            List<CompletableFuture<ExtractionOutcome>> futures = new ArrayList<>();
            for (SourceDocument document : batch) {
                futures.add(CompletableFuture.supplyAsync(() -> extract(document, cancellation), executor));
            }

            List<FileContribution> contributions = new ArrayList<>();
            List<UnparsedFile> unparsed = new ArrayList<>();
            try {
                for (CompletableFuture<ExtractionOutcome> future : futures) {
                    ExtractionOutcome outcome = future.join();
                    if (outcome.isParsed()) {
                        contributions.add(outcome.contribution());
                    } else {
                        unparsed.add(outcome.unparsed());
                    }
                }
            } catch (CompletionException e) {
                futures.forEach(f -> f.cancel(false));
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }

            cancellation.throwIfCancelled();
            DependencyGraph graph = graphBuilder.build(contributions, unparsed);
            cancellation.throwIfCancelled();
            Snapshot snapshot = store.publish(graph);

            Duration duration = Duration.between(start, Instant.now());
            if (!unparsed.isEmpty()) {
                log.warn("{} of {} documents could not be parsed", unparsed.size(), batch.size());
            }
            log.info("Ingestion complete in {} ms: snapshot v{}", duration.toMillis(), snapshot.version());
            return new IngestionSummary(
                    snapshot.version(),
                    batch.size(),
                    contributions.size(),
                    graph.unparsedFiles(),
                    graph.nodeCount(),
                    graph.edgeCount(),
                    graph.unresolvedReferences().size(),
                    duration);
        }
    }

    private ExtractionOutcome extract(SourceDocument document, CancellationToken cancellation) {
        cancellation.throwIfCancelled();
        ExtractionOutcome outcome = extractors.extract(document);
        if (!outcome.isParsed()) {
            return outcome;
        }
        return ExtractionOutcome.parsed(outcome.contribution().withRiskScan(riskScanner.scan(document)));
    }

    /**
     * Checks the batch and returns it with normalized paths.
     */
    static List<SourceDocument> validate(List<SourceDocument> documents) throws ValidationException {
        if (documents == null) {
            throw new ValidationException(List.of("document list is null"));
        }
        List<String> problems = new ArrayList<>();
        List<SourceDocument> normalized = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < documents.size(); i++) {
            SourceDocument document = documents.get(i);
            if (document == null) {
                problems.add("document #" + i + " is null");
                continue;
            }
            String raw = document.path();
            if (raw == null || raw.isBlank()) {
                problems.add("document #" + i + " has no path");
                continue;
            }
            String path = NodeIds.normalizePath(raw);
            if (path == null) {
                problems.add("path escapes the repository root: " + raw);
                continue;
            }
            if (path.isEmpty()) {
                problems.add("document #" + i + " has no path");
                continue;
            }
            if (!seen.add(path)) {
                problems.add("duplicate path: " + path);
                continue;
            }
            if (document.content() == null) {
                problems.add("document has no content: " + path);
                continue;
            }
            normalized.add(new SourceDocument(path, document.language(), document.content()));
        }
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
        return normalized;
    }

    public IntegrityReport analyze() {
        return analyze(CancellationToken.none());
    }

    /**
     * Runs all detectors against the current snapshot.
     */
    public IntegrityReport analyze(CancellationToken cancellation) {
        try (SnapshotLease lease = store.acquire()) {
            return analyzer.analyze(lease.graph(), lease.version(), cancellation);
        }
    }

    public ImpactResult simulate(ChangeSpec change) throws NodeNotFoundException {
        return simulate(change, CancellationToken.none());
    }

    /**
     * Computes the blast radius of a change against the current snapshot.
     *
     * @throws NodeNotFoundException if the target is not in the current snapshot
     */
    public ImpactResult simulate(ChangeSpec change, CancellationToken cancellation) throws NodeNotFoundException {
        try (SnapshotLease lease = store.acquire()) {
            return simulator.simulate(lease.graph(), lease.version(), change, cancellation);
        }
    }

    /**
     * Retains the current snapshot for export or repeated queries. The caller must close the lease.
     */
    public SnapshotLease acquireSnapshot() {
        return store.acquire();
    }

    public long currentVersion() {
        return store.currentVersion();
    }

    public SnapshotStore snapshots() {
        return store;
    }

    public AnalysisConfig config() {
        return config;
    }

    @Override
    public void close() {
        shutdown(executor);
        shutdown(detectorExecutor);
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
