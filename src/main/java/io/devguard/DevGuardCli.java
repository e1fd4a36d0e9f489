package io.devguard;

import io.devguard.config.AnalysisConfig;
import io.devguard.detectors.Detector;
import io.devguard.detectors.DetectorRegistry;
import io.devguard.engine.DevGuardEngine;
import io.devguard.engine.IngestionSummary;
import io.devguard.engine.ValidationException;
import io.devguard.graph.DependencyGraph;
import io.devguard.graph.SnapshotLease;
import io.devguard.impact.NodeNotFoundException;
import io.devguard.ingest.SourceTreeLoader;
import io.devguard.model.ChangeKind;
import io.devguard.model.ChangeSpec;
import io.devguard.model.ImpactResult;
import io.devguard.model.IntegrityReport;
import io.devguard.model.Node;
import io.devguard.model.Severity;
import io.devguard.model.SourceDocument;
import io.devguard.model.UnparsedFile;
import io.devguard.report.ConsoleReporter;
import io.devguard.report.JsonReporter;
import io.devguard.report.Reporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI entry point for devguard.
 */
@Command(
        name = "devguard",
        mixinStandardHelpOptions = true,
        version = "devguard 1.0.0",
        description = "Builds a cross-stack dependency graph of a source tree, reports architectural smells "
                + "and production risks, and simulates the blast radius of a change.",
        footer = {
                "",
                "Examples:",
                "  devguard /path/to/repo",
                "  devguard /path/to/repo --format json --output report.json --graph-output graph.json",
                "  devguard /path/to/repo --impact app.models.User --change rename",
                "  devguard /path/to/repo --fail-on medium --no-color"
        }
)
public class DevGuardCli implements Callable<Integer> {

    @Parameters(
            index = "0",
            arity = "0..1",
            description = "Path to the source tree to analyze"
    )
    private Path projectPath;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file (defaults to devguard.yaml in the analyzed directory)"
    )
    private Path configFile;

    @Option(
            names = {"-f", "--format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat format;

    @Option(
            names = {"-o", "--output"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"--graph-output"},
            description = "Also export the graph snapshot as JSON to this file"
    )
    private Path graphOutput;

    @Option(
            names = {"-i", "--impact"},
            description = "Simulate a change to this node, given by id or qualified name, instead of running detectors"
    )
    private String impactTarget;

    @Option(
            names = {"--change"},
            description = "Change kind for --impact: rename (default), remove, signature-change",
            defaultValue = "rename"
    )
    private String changeKind;

    @Option(
            names = {"--fail-on"},
            description = "Exit with code 2 if findings at this severity or higher: high, medium, low",
            defaultValue = "high"
    )
    private String failOnLevel;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"--list-detectors"},
            description = "List the available detectors and exit"
    )
    private boolean listDetectors;

    @Option(
            names = {"-d", "--detailed"},
            description = "Show every finding with its evidence"
    )
    private boolean detailed;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        try {
            if (listDetectors) {
                printDetectors();
                return 0;
            }
            if (projectPath == null) {
                System.err.println("Error: Missing path to the source tree");
                return 1;
            }
            if (!Files.exists(projectPath)) {
                System.err.println("Error: Path does not exist: " + projectPath);
                return 1;
            }

            Severity failLevel;
            ChangeKind change;
            try {
                failLevel = Severity.parse(failOnLevel);
                change = ChangeKind.parse(changeKind);
            } catch (IllegalArgumentException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }

            AnalysisConfig config = loadConfig();

            log("Loading sources from " + projectPath.toAbsolutePath().normalize() + "...");
            SourceTreeLoader loader = new SourceTreeLoader(config.extraction().excludedPathSegments());
            List<SourceDocument> documents = loader.load(projectPath);
            log("  Found " + documents.size() + " source files");

            try (DevGuardEngine engine = new DevGuardEngine(config)) {
                log("Building dependency graph...");
                IngestionSummary summary = engine.ingest(documents);
                log(String.format("  %d nodes, %d edges, %d unresolved references, %d/%d files parsed",
                        summary.nodeCount(), summary.edgeCount(), summary.unresolvedCount(),
                        summary.parsedFiles(), summary.totalFiles()));
                if (verbose) {
                    for (UnparsedFile file : summary.unparsedFiles()) {
                        log("  Skipped " + file.path() + ": " + file.detail());
                    }
                }

                try (SnapshotLease lease = engine.acquireSnapshot()) {
                    DependencyGraph graph = lease.graph();
                    if (graphOutput != null) {
                        writeGraph(graph, lease.version());
                    }

                    Reporter reporter = createReporter();
                    log("Writing " + reporter.format() + " output");
                    if (impactTarget != null) {
                        String targetId = resolveTarget(graph, impactTarget);
                        if (targetId == null) {
                            return 1;
                        }
                        log("Simulating " + change.name().toLowerCase(Locale.ROOT) + " of " + impactTarget + "...");
                        ImpactResult result = engine.simulate(new ChangeSpec(targetId, change));
                        writeOutput(writer -> reporter.writeImpact(result, graph, writer));
                        return 0;
                    }

                    log("Running integrity detectors...");
                    IntegrityReport report = engine.analyze();
                    writeOutput(writer -> reporter.writeReport(report, graph, writer));

                    if (report.hasFindingsAtLeast(failLevel)) {
                        if (format == OutputFormat.console) {
                            System.err.println();
                            System.err.println("Failing due to findings at " + failLevel.label() + " severity or higher.");
                        }
                        return 2;
                    }
                    return 0;
                }
            }

        } catch (ValidationException | NodeNotFoundException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private AnalysisConfig loadConfig() throws IOException {
        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Configuration file not found: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return AnalysisConfig.loadFromFile(configFile);
        }

        // Check for devguard.yaml in the analyzed directory
        if (Files.isDirectory(projectPath)) {
            Path projectConfig = projectPath.resolve("devguard.yaml");
            if (Files.exists(projectConfig)) {
                log("Loading configuration from: " + projectConfig);
                return AnalysisConfig.loadFromFile(projectConfig);
            }
        }

        return AnalysisConfig.loadDefault();
    }

    /**
     * Accepts a node id or a unique qualified name.
     */
    private String resolveTarget(DependencyGraph graph, String target) {
        if (graph.containsNode(target)) {
            return target;
        }
        List<Node> matches = graph.findByQualifiedName(target);
        if (matches.size() == 1) {
            return matches.get(0).id();
        }
        if (matches.size() > 1) {
            System.err.println("Error: '" + target + "' is ambiguous, use one of these node ids:");
            for (Node node : matches) {
                System.err.println("  " + node.id() + "  " + node.kind().displayName() + " " + node.location());
            }
            return null;
        }
        return target;
    }

    private Reporter createReporter() {
        return switch (format) {
            case console -> new ConsoleReporter(!noColor, detailed, projectPath.toAbsolutePath().normalize().toString());
            case json -> new JsonReporter(true);
        };
    }

    @FunctionalInterface
    private interface ReportWriter {
        void write(Writer writer) throws IOException;
    }

    private void writeOutput(ReportWriter reportWriter) throws IOException {
        if (outputFile != null) {
            try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
                reportWriter.write(writer);
            }
            if (format == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            PrintWriter writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            reportWriter.write(writer);
            writer.flush();
        }
    }

    private void writeGraph(DependencyGraph graph, long version) throws IOException {
        try (Writer writer = Files.newBufferedWriter(graphOutput, StandardCharsets.UTF_8)) {
            new JsonReporter(true).writeGraph(graph, version, writer);
        }
        log("Graph written to: " + graphOutput);
    }

    private void printDetectors() {
        System.out.println("Available detectors:");
        for (Detector detector : DetectorRegistry.createDefault().allDetectors()) {
            System.out.printf("  %-16s %-16s %s%n",
                    detector.id(), detector.kind().name(), detector.description());
        }
    }

    private void log(String message) {
        if (verbose && format != OutputFormat.json) {
            System.out.println(message);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DevGuardCli()).execute(args);
        System.exit(exitCode);
    }
}
