package io.devguard.report;

import io.devguard.graph.DependencyGraph;
import io.devguard.model.Edge;
import io.devguard.model.FindingKind;
import io.devguard.model.ImpactEntry;
import io.devguard.model.ImpactResult;
import io.devguard.model.IntegrityFinding;
import io.devguard.model.IntegrityReport;
import io.devguard.model.Node;
import io.devguard.model.Severity;
import io.devguard.model.UnparsedFile;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * The default view shows a summary, a per-kind breakdown and the high and medium
 * findings. Use --detailed for every finding with its evidence.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private static final int WIDTH = 70;
    private static final int MAX_EVIDENCE = 10;

    private final boolean useColors;
    private final boolean detailed;
    private final String projectLabel;

    public ConsoleReporter() {
        this(true, false, null);
    }

    public ConsoleReporter(boolean useColors, boolean detailed) {
        this(useColors, detailed, null);
    }

    public ConsoleReporter(boolean useColors, boolean detailed, String projectLabel) {
        this.useColors = useColors;
        this.detailed = detailed;
        this.projectLabel = projectLabel;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void writeReport(IntegrityReport report, DependencyGraph graph, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, "DEVGUARD INTEGRITY REPORT", report.snapshotVersion());
        printSummary(out, report, graph);
        printKindBreakdown(out, report);
        printFindings(out, report, graph);
        printUnparsed(out, report.unparsedFiles());
        printFooter(out, report);
        out.flush();
    }

    @Override
    public void writeImpact(ImpactResult result, DependencyGraph graph, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, "DEVGUARD BLAST RADIUS", result.snapshotVersion());
        out.println("Change: " + result.change().kind().name().toLowerCase(Locale.ROOT).replace('_', '-')
                + " " + bold(nameOf(graph, result.change().targetId())));
        out.println("Affected: " + result.size() + " nodes");
        out.println();

        if (result.isEmpty()) {
            out.println(color(GREEN, "Nothing depends on this node through the affected edge kinds."));
            out.println();
            out.flush();
            return;
        }

        Map<Integer, List<ImpactEntry>> byDistance = result.entries().stream()
                .collect(Collectors.groupingBy(ImpactEntry::distance, TreeMap::new, Collectors.toList()));
        byDistance.forEach((distance, entries) -> {
            out.println(bold("DISTANCE " + distance) + color(CYAN, " (" + entries.size() + ")"));
            out.println(line('-', 40));
            for (ImpactEntry entry : entries) {
                Node node = graph.node(entry.nodeId()).orElse(null);
                String label = node != null
                        ? node.kind().displayName() + " " + node.qualifiedName() + " (" + node.location() + ")"
                        : entry.nodeId();
                out.printf(Locale.ROOT, "  %s %s%n", confidenceTag(entry.confidence()), label);
            }
            out.println();
        });
        out.flush();
    }

    private void printHeader(PrintWriter out, String title, long version) {
        out.println();
        out.println(line('=', WIDTH));
        out.println(center(title, WIDTH));
        out.println(line('=', WIDTH));
        out.println();
        if (projectLabel != null) {
            out.println("Project: " + projectLabel);
        }
        out.println("Snapshot: v" + version);
        out.println();
    }

    private void printSummary(PrintWriter out, IntegrityReport report, DependencyGraph graph) {
        out.println(bold("SUMMARY"));
        out.println(line('-', WIDTH));

        out.println(String.format(Locale.ROOT, "Graph: %,d nodes | %,d edges | %d/%d files parsed (%.1f%% coverage)",
                graph.nodeCount(), graph.edgeCount(), graph.parsedFiles(), graph.totalFiles(),
                report.coverage() * 100));

        long high = report.countBySeverity(Severity.HIGH);
        long medium = report.countBySeverity(Severity.MEDIUM);
        long low = report.countBySeverity(Severity.LOW);
        StringBuilder findings = new StringBuilder("Findings: ");
        findings.append(high > 0 ? color(RED, high + " high") : "0 high").append(" | ");
        findings.append(medium > 0 ? color(YELLOW, medium + " medium") : "0 medium").append(" | ");
        findings.append(low).append(" low");
        out.println(findings);

        if (report.unresolvedCount() > 0) {
            out.println("Unresolved references: " + report.unresolvedCount());
        }
        out.println();
    }

    private void printKindBreakdown(PrintWriter out, IntegrityReport report) {
        Map<FindingKind, List<IntegrityFinding>> byKind = report.findingsByKind();
        if (byKind.isEmpty()) {
            return;
        }

        out.println(bold("BY KIND"));
        out.println(line('-', 40));
        for (FindingKind kind : FindingKind.values()) {
            List<IntegrityFinding> findings = byKind.getOrDefault(kind, List.of());
            if (!findings.isEmpty()) {
                out.printf("  %s: %d%n", kind.displayName(), findings.size());
            }
        }
        out.println();
    }

    private void printFindings(PrintWriter out, IntegrityReport report, DependencyGraph graph) {
        List<IntegrityFinding> shown = detailed
                ? report.findings()
                : report.findings().stream().filter(f -> f.severity().isAtLeast(Severity.MEDIUM)).toList();
        if (shown.isEmpty()) {
            return;
        }

        out.println(bold(detailed ? "FINDINGS" : "HIGH AND MEDIUM FINDINGS") + color(CYAN, " (" + shown.size() + ")"));
        out.println(line('=', WIDTH));
        int index = 1;
        for (IntegrityFinding finding : shown) {
            printFinding(out, index++, finding, graph);
        }
    }

    private void printFinding(PrintWriter out, int index, IntegrityFinding finding, DependencyGraph graph) {
        out.println("[" + index + "] " + severityIndicator(finding.severity()) + " "
                + bold(finding.kind().displayName()) + " " + finding.description());
        if (finding.location() != null) {
            out.println("    Location: " + finding.location());
        }
        if (detailed) {
            if (finding.matchedPattern() != null) {
                out.println("    Pattern: " + finding.matchedPattern());
            }
            out.println("    Nodes: " + finding.nodeIds().stream()
                    .map(id -> nameOf(graph, id))
                    .collect(Collectors.joining(", ")));
            List<Edge> evidence = finding.evidenceEdges();
            for (int i = 0; i < Math.min(MAX_EVIDENCE, evidence.size()); i++) {
                Edge edge = evidence.get(i);
                out.println("    " + nameOf(graph, edge.sourceId()) + " -" + edge.kind().displayName() + "-> "
                        + nameOf(graph, edge.targetId())
                        + (edge.provenance() != null ? " (" + edge.provenance().location() + ")" : ""));
            }
            if (evidence.size() > MAX_EVIDENCE) {
                out.println("    ... and " + (evidence.size() - MAX_EVIDENCE) + " more edges");
            }
        }
        out.println();
    }

    private void printUnparsed(PrintWriter out, List<UnparsedFile> unparsed) {
        if (unparsed.isEmpty()) {
            return;
        }
        out.println(bold("UNPARSED FILES") + color(CYAN, " (" + unparsed.size() + ")"));
        out.println(line('-', 40));
        for (UnparsedFile file : unparsed) {
            out.println("  " + file.path() + " - " + file.reason().name().toLowerCase(Locale.ROOT).replace('_', ' ')
                    + (file.detail().isEmpty() ? "" : ": " + file.detail()));
        }
        out.println();
    }

    private void printFooter(PrintWriter out, IntegrityReport report) {
        out.println(line('=', WIDTH));

        long high = report.countBySeverity(Severity.HIGH);
        long medium = report.countBySeverity(Severity.MEDIUM);
        if (high > 0) {
            out.println(color(RED, bold("ACTION REQUIRED: " + high + " high-severity finding(s).")));
        } else if (medium > 0) {
            out.println(color(YELLOW, "ATTENTION: " + medium + " medium-severity finding(s) should be reviewed."));
        } else {
            out.println(color(GREEN, "No high or medium findings."));
        }

        if (!detailed && report.totalFindings() > 0) {
            out.println();
            out.println("Run with --detailed for complete finding details.");
        }
        out.println();
    }

    private String severityIndicator(Severity severity) {
        return switch (severity) {
            case HIGH -> color(RED, "[HIGH]");
            case MEDIUM -> color(YELLOW, "[MED]");
            case LOW -> "[LOW]";
        };
    }

    private String confidenceTag(double confidence) {
        String tag = String.format(Locale.ROOT, "[%.2f]", confidence);
        return confidence >= 1.0 ? tag : color(YELLOW, tag);
    }

    private static String nameOf(DependencyGraph graph, String id) {
        return graph.node(id).map(Node::qualifiedName).orElse(id);
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
