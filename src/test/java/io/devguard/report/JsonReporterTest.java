package io.devguard.report;

import com.fasterxml.jackson.databind.JsonNode;
import io.devguard.model.IntegrityReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    private ReportFixtures fixtures;
    private JsonReporter reporter;

    @BeforeEach
    void setUp() {
        fixtures = new ReportFixtures();
        reporter = new JsonReporter();
    }

    @Test
    void writeReport_includesMetadataSummaryAndFindings() throws IOException {
        IntegrityReport report = fixtures.report(fixtures.cycle(), fixtures.secret(), fixtures.orphan());

        JsonNode json = reporter.mapper().readTree(reporter.toString(report, fixtures.graph));

        JsonNode metadata = json.get("metadata");
        assertThat(metadata.get("snapshotVersion").asLong()).isEqualTo(4);
        assertThat(metadata.get("analyzedAt").asText()).isEqualTo("2026-03-01T10:15:30Z");
        assertThat(metadata.get("durationMs").asLong()).isEqualTo(12);
        assertThat(metadata.get("totalFiles").asInt()).isEqualTo(3);
        assertThat(metadata.get("parsedFiles").asInt()).isEqualTo(2);
        assertThat(metadata.get("unresolvedReferences").asInt()).isEqualTo(2);

        JsonNode summary = json.get("summary");
        assertThat(summary.get("high").asInt()).isEqualTo(1);
        assertThat(summary.get("medium").asInt()).isEqualTo(1);
        assertThat(summary.get("low").asInt()).isEqualTo(1);
        assertThat(summary.get("byKind").get("Cycle").asInt()).isEqualTo(1);

        JsonNode cycle = json.get("findings").get(0);
        assertThat(cycle.get("kind").asText()).isEqualTo("Cycle");
        assertThat(cycle.get("severity").asText()).isEqualTo("MEDIUM");
        assertThat(cycle.get("nodes")).extracting(JsonNode::asText).containsExactlyInAnyOrder("svc.a", "svc.b");
        assertThat(cycle.get("evidence")).hasSize(2);
        assertThat(cycle.get("evidence").get(0).get("kind").asText()).isEqualTo("Calls");
        assertThat(cycle.has("location")).isFalse();

        JsonNode secret = json.get("findings").get(1);
        assertThat(secret.get("matchedPattern").asText()).isEqualTo("sk_live_[0-9a-zA-Z]{24}");
        assertThat(secret.get("location").asText()).isEqualTo("app/svc_a.py:2");
        assertThat(secret.has("evidence")).isFalse();

        JsonNode unparsed = json.get("unparsedFiles").get(0);
        assertThat(unparsed.get("path").asText()).isEqualTo("broken/bad.py");
        assertThat(unparsed.get("language").asText()).isEqualTo("python");
        assertThat(unparsed.get("reason").asText()).isEqualTo("SYNTAX_ERROR");
    }

    @Test
    void writeImpact_listsAffectedNodes() throws IOException {
        JsonNode json = reporter.mapper().readTree(reporter.toString(fixtures.impactOnB(), fixtures.graph));

        assertThat(json.get("change").get("target").asText()).isEqualTo("svc.b");
        assertThat(json.get("change").get("kind").asText()).isEqualTo("RENAME");
        assertThat(json.get("affectedCount").asInt()).isEqualTo(1);
        JsonNode affected = json.get("affected").get(0);
        assertThat(affected.get("qualifiedName").asText()).isEqualTo("svc.a");
        assertThat(affected.get("kind").asText()).isEqualTo("Function");
        assertThat(affected.get("location").asText()).isEqualTo("app/svc_a.py:3");
        assertThat(affected.get("distance").asInt()).isEqualTo(1);
        assertThat(affected.get("confidence").asDouble()).isEqualTo(1.0);
    }

    @Test
    void writeGraph_exportsNodesEdgesAndDiagnostics() throws IOException {
        StringWriter out = new StringWriter();
        reporter.writeGraph(fixtures.graph, 4, out);

        JsonNode json = reporter.mapper().readTree(out.toString());

        assertThat(json.get("snapshotVersion").asLong()).isEqualTo(4);
        assertThat(json.get("totalFiles").asInt()).isEqualTo(3);
        assertThat(json.get("nodes")).hasSize(2);
        JsonNode first = json.get("nodes").get(0);
        assertThat(first.get("qualifiedName").asText()).isEqualTo("svc.a");
        assertThat(first.get("language").asText()).isEqualTo("python");
        assertThat(first.get("line").asInt()).isEqualTo(3);
        assertThat(first.get("signature").get(0).get("name").asText()).isEqualTo("user_id");
        assertThat(first.get("signature").get(0).get("type").asText()).isEqualTo("int");
        assertThat(json.get("nodes").get(1).has("signature")).isFalse();

        assertThat(json.get("edges")).hasSize(2);
        assertThat(json.get("edges")).extracting(e -> e.get("confidence").asDouble())
                .containsExactlyInAnyOrder(1.0, 0.8);
        assertThat(json.get("edges").get(0).get("provenance").get("startLine").asInt()).isEqualTo(1);
        assertThat(json.get("unparsedFiles")).hasSize(1);
        assertThat(json.get("unresolvedReferences")).isEmpty();
    }

    @Test
    void writeGraph_isStableAcrossCalls() throws IOException {
        StringWriter first = new StringWriter();
        StringWriter second = new StringWriter();

        reporter.writeGraph(fixtures.graph, 4, first);
        reporter.writeGraph(fixtures.graph, 4, second);

        assertThat(second.toString()).isEqualTo(first.toString());
    }

    @Test
    void writeReport_writesToFile(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("report.json");

        reporter.writeReport(fixtures.report(fixtures.secret()), fixtures.graph, target);

        assertThat(reporter.mapper().readTree(Files.readString(target)).get("summary").get("total").asInt())
                .isEqualTo(1);
    }

    @Test
    void compactOutput_hasNoLineBreaks() {
        String json = new JsonReporter(false).toString(fixtures.report(), fixtures.graph);

        assertThat(json).doesNotContain("\n").contains("\"metadata\":{");
    }
}
