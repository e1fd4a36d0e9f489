package io.devguard.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.Edge;
import io.devguard.model.ImpactEntry;
import io.devguard.model.ImpactResult;
import io.devguard.model.IntegrityFinding;
import io.devguard.model.IntegrityReport;
import io.devguard.model.Node;
import io.devguard.model.Provenance;
import io.devguard.model.Severity;
import io.devguard.model.SignatureParam;
import io.devguard.model.UnparsedFile;
import io.devguard.model.UnresolvedReference;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Formats analysis results and graph snapshots as JSON for machine processing
 * and for the graph visualization layer.
 * <p>
 * Output is stable: collections are written in the order the core produces them
 * and map keys are sorted.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        m.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void writeReport(IntegrityReport report, DependencyGraph graph, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report, graph));
    }

    @Override
    public void writeImpact(ImpactResult result, DependencyGraph graph, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonImpact(result, graph));
    }

    /**
     * Exports a graph snapshot: ordered nodes and edges plus ingestion diagnostics.
     */
    public void writeGraph(DependencyGraph graph, long snapshotVersion, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonGraph(graph, snapshotVersion));
    }

    private JsonReport toJsonReport(IntegrityReport report, DependencyGraph graph) {
        Map<String, Integer> byKind = new TreeMap<>();
        report.findings().forEach(f -> byKind.merge(f.kind().displayName(), 1, Integer::sum));
        return new JsonReport(
                new JsonReport.Metadata(
                        report.snapshotVersion(),
                        report.analyzedAt(),
                        report.duration().toMillis(),
                        report.coverage(),
                        graph.totalFiles(),
                        graph.parsedFiles(),
                        report.unresolvedCount()
                ),
                new JsonReport.Summary(
                        report.countBySeverity(Severity.HIGH),
                        report.countBySeverity(Severity.MEDIUM),
                        report.countBySeverity(Severity.LOW),
                        report.totalFindings(),
                        byKind
                ),
                report.findings().stream().map(f -> toJsonFinding(f, graph)).toList(),
                report.unparsedFiles().stream().map(JsonReporter::toJsonUnparsed).toList()
        );
    }

    private JsonReport.Finding toJsonFinding(IntegrityFinding finding, DependencyGraph graph) {
        return new JsonReport.Finding(
                finding.kind().displayName(),
                finding.severity().name(),
                finding.nodeIds(),
                finding.nodeIds().stream().map(id -> nameOf(graph, id)).toList(),
                finding.description(),
                finding.matchedPattern(),
                finding.location(),
                finding.detectorId(),
                finding.evidenceEdges().isEmpty()
                        ? null
                        : finding.evidenceEdges().stream().map(JsonReporter::toJsonEdge).toList()
        );
    }

    private JsonImpact toJsonImpact(ImpactResult result, DependencyGraph graph) {
        return new JsonImpact(
                result.snapshotVersion(),
                new JsonImpact.Change(result.change().targetId(), nameOf(graph, result.change().targetId()),
                        result.change().kind().name()),
                result.size(),
                result.entries().stream().map(e -> toJsonAffected(e, graph)).toList()
        );
    }

    private static JsonImpact.Affected toJsonAffected(ImpactEntry entry, DependencyGraph graph) {
        Node node = graph.node(entry.nodeId()).orElse(null);
        return new JsonImpact.Affected(
                entry.nodeId(),
                node != null ? node.qualifiedName() : null,
                node != null ? node.kind().displayName() : null,
                node != null ? node.location() : null,
                entry.distance(),
                entry.confidence()
        );
    }

    private JsonGraph toJsonGraph(DependencyGraph graph, long snapshotVersion) {
        return new JsonGraph(
                snapshotVersion,
                graph.coverage(),
                graph.totalFiles(),
                graph.nodes().stream().map(JsonReporter::toJsonNode).toList(),
                graph.edges().stream().map(JsonReporter::toJsonEdge).toList(),
                graph.unparsedFiles().stream().map(JsonReporter::toJsonUnparsed).toList(),
                graph.unresolvedReferences().stream().map(JsonReporter::toJsonUnresolved).toList()
        );
    }

    private static JsonGraph.Node toJsonNode(Node node) {
        return new JsonGraph.Node(
                node.id(),
                node.kind().displayName(),
                node.language().tag(),
                node.path(),
                node.qualifiedName(),
                node.name(),
                node.line() > 0 ? node.line() : null,
                node.signature().isEmpty()
                        ? null
                        : node.signature().stream().map(JsonReporter::toJsonParam).toList()
        );
    }

    private static JsonGraph.Param toJsonParam(SignatureParam param) {
        return new JsonGraph.Param(param.name(), param.typeHint());
    }

    private static JsonEdge toJsonEdge(Edge edge) {
        return new JsonEdge(edge.sourceId(), edge.targetId(), edge.kind().displayName(), edge.confidence(),
                toJsonProvenance(edge.provenance()));
    }

    private static JsonProvenance toJsonProvenance(Provenance provenance) {
        if (provenance == null) {
            return null;
        }
        return new JsonProvenance(provenance.path(), provenance.startLine(), provenance.endLine());
    }

    private static JsonUnparsed toJsonUnparsed(UnparsedFile file) {
        return new JsonUnparsed(file.path(), file.language().tag(), file.reason().name(), file.detail());
    }

    private static JsonGraph.Unresolved toJsonUnresolved(UnresolvedReference reference) {
        return new JsonGraph.Unresolved(reference.sourceId(), reference.targetName(), reference.kind().displayName(),
                toJsonProvenance(reference.provenance()));
    }

    private static String nameOf(DependencyGraph graph, String id) {
        return graph.node(id).map(Node::qualifiedName).orElse(id);
    }

    /**
     * JSON structure for an integrity report.
     */
    public record JsonReport(
            Metadata metadata,
            Summary summary,
            List<Finding> findings,
            List<JsonUnparsed> unparsedFiles
    ) {
        public record Metadata(
                long snapshotVersion,
                Instant analyzedAt,
                long durationMs,
                double coverage,
                int totalFiles,
                int parsedFiles,
                int unresolvedReferences
        ) {}

        public record Summary(
                long high,
                long medium,
                long low,
                int total,
                Map<String, Integer> byKind
        ) {}

        public record Finding(
                String kind,
                String severity,
                List<String> nodeIds,
                List<String> nodes,
                String description,
                String matchedPattern,
                String location,
                String detectorId,
                List<JsonEdge> evidence
        ) {}
    }

    /**
     * JSON structure for a blast radius simulation.
     */
    public record JsonImpact(
            long snapshotVersion,
            Change change,
            int affectedCount,
            List<Affected> affected
    ) {
        public record Change(String targetId, String target, String kind) {}

        public record Affected(
                String nodeId,
                String qualifiedName,
                String kind,
                String location,
                int distance,
                double confidence
        ) {}
    }

    /**
     * JSON structure for a graph snapshot export.
     */
    public record JsonGraph(
            long snapshotVersion,
            double coverage,
            int totalFiles,
            List<Node> nodes,
            List<JsonEdge> edges,
            List<JsonUnparsed> unparsedFiles,
            List<Unresolved> unresolvedReferences
    ) {
        public record Node(
                String id,
                String kind,
                String language,
                String path,
                String qualifiedName,
                String name,
                Integer line,
                List<Param> signature
        ) {}

        public record Param(String name, String type) {}

        public record Unresolved(String sourceId, String targetName, String kind, JsonProvenance provenance) {}
    }

    public record JsonEdge(String source, String target, String kind, double confidence, JsonProvenance provenance) {}

    public record JsonProvenance(String path, int startLine, int endLine) {}

    public record JsonUnparsed(String path, String language, String reason, String detail) {}
}
