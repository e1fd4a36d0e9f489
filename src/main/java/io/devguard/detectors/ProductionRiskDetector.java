package io.devguard.detectors;

import io.devguard.config.AnalysisConfig;
import io.devguard.config.GlobPattern;
import io.devguard.config.RiskRule;
import io.devguard.engine.CancellationToken;
import io.devguard.extract.FileContribution.RiskScan;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.FindingKind;
import io.devguard.model.IntegrityFinding;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import io.devguard.model.RiskMarker;
import io.devguard.model.Severity;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Reports production-readiness risks found in raw source text: hardcoded secrets,
 * debug flags, permissive host and CORS settings, leftover debug output, unpinned
 * dependencies, floating base images, committed key or environment files, and a high
 * density of TODO/FIXME/HACK markers.
 * <p>
 * Markers are collected at extraction time by {@link RiskScanner}; this detector
 * groups them into one finding per file and rule, attached to the owning File node.
 */
public class ProductionRiskDetector implements Detector {

    private static final int MAX_LISTED_LINES = 5;

    @Override
    public String id() {
        return "production-risk";
    }

    @Override
    public String description() {
        return "Detects secrets, debug settings and unfinished code";
    }

    @Override
    public FindingKind kind() {
        return FindingKind.PRODUCTION_RISK;
    }

    @Override
    public List<IntegrityFinding> detect(DependencyGraph graph, AnalysisConfig config,
                                         CancellationToken cancellation) {
        AnalysisConfig.ProductionRisk settings = config.productionRisk();
        Map<String, RiskRule> rules = settings.rules().stream()
                .collect(Collectors.toMap(RiskRule::id, r -> r, (a, b) -> a));

        List<IntegrityFinding> findings = new ArrayList<>();
        for (RiskScan scan : graph.riskScans().values()) {
            cancellation.throwIfCancelled();
            Optional<Node> fileNode = fileNode(graph, scan.path());
            if (fileNode.isEmpty()) {
                continue;
            }

            Map<String, List<RiskMarker>> byRule = scan.markers().stream()
                    .collect(Collectors.groupingBy(RiskMarker::ruleId, TreeMap::new, Collectors.toList()));
            byRule.forEach((ruleId, markers) ->
                    findings.add(ruleFinding(fileNode.get(), rules.get(ruleId), ruleId, markers)));

            todoFinding(fileNode.get(), scan, settings).ifPresent(findings::add);
        }
        return findings;
    }

    private static Optional<Node> fileNode(DependencyGraph graph, String path) {
        return graph.findByQualifiedName(path).stream()
                .filter(n -> n.kind() == NodeKind.FILE && n.path().equals(path))
                .findFirst();
    }

    private IntegrityFinding ruleFinding(Node file, RiskRule rule, String ruleId, List<RiskMarker> markers) {
        RiskMarker first = markers.get(0);
        if (first.line() == 0) {
            return fileFinding(file, rule, ruleId);
        }
        String lines = markers.stream()
                .limit(MAX_LISTED_LINES)
                .map(m -> String.valueOf(m.line()))
                .collect(Collectors.joining(", "));
        if (markers.size() > MAX_LISTED_LINES) {
            lines += ", ...";
        }
        String summary = rule != null ? rule.description() : ruleId;
        return IntegrityFinding.builder()
                .kind(FindingKind.PRODUCTION_RISK)
                .severity(rule != null ? rule.severity() : Severity.MEDIUM)
                .nodeId(file.id())
                .matchedPattern(rule != null && rule.pattern() != null ? rule.pattern().pattern() : ruleId)
                .description(summary + " [" + ruleId + "]: " + markers.size()
                        + (markers.size() == 1 ? " occurrence" : " occurrences")
                        + " on line" + (markers.size() == 1 ? " " : "s ") + lines
                        + " (" + first.excerpt() + ")")
                .detectorId(id())
                .location(file.path() + ":" + first.line())
                .build();
    }

    private IntegrityFinding fileFinding(Node file, RiskRule rule, String ruleId) {
        String summary = rule != null ? rule.description() : ruleId;
        String globs = rule != null
                ? rule.files().stream().map(GlobPattern::glob).collect(Collectors.joining(", "))
                : ruleId;
        return IntegrityFinding.builder()
                .kind(FindingKind.PRODUCTION_RISK)
                .severity(rule != null ? rule.severity() : Severity.MEDIUM)
                .nodeId(file.id())
                .matchedPattern(globs)
                .description(summary + " [" + ruleId + "]: " + file.path())
                .detectorId(id())
                .location(file.path())
                .build();
    }

    private Optional<IntegrityFinding> todoFinding(Node file, RiskScan scan, AnalysisConfig.ProductionRisk settings) {
        if (scan.lineCount() == 0 || scan.todoCount() < settings.todoMinimumCount()) {
            return Optional.empty();
        }
        double density = (double) scan.todoCount() / scan.lineCount();
        if (density <= settings.todoDensityThreshold()) {
            return Optional.empty();
        }
        return Optional.of(IntegrityFinding.builder()
                .kind(FindingKind.PRODUCTION_RISK)
                .severity(settings.todoSeverity())
                .nodeId(file.id())
                .matchedPattern(settings.todoPattern().pattern())
                .description(String.format(Locale.ROOT,
                        "High TODO density [todo-density]: %d markers in %d lines (%.1f%%)",
                        scan.todoCount(), scan.lineCount(), density * 100))
                .detectorId(id())
                .location(file.path())
                .build());
    }
}
