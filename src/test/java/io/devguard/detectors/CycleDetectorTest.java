package io.devguard.detectors;

import io.devguard.config.AnalysisConfig;
import io.devguard.engine.AnalysisCancelledException;
import io.devguard.engine.CancellationToken;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.EdgeKind;
import io.devguard.model.FindingKind;
import io.devguard.model.IntegrityFinding;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import io.devguard.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.devguard.TestGraphs.edge;
import static io.devguard.TestGraphs.function;
import static io.devguard.TestGraphs.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CycleDetectorTest {

    private CycleDetector detector;
    private AnalysisConfig config;

    @BeforeEach
    void setUp() {
        detector = new CycleDetector();
        config = AnalysisConfig.loadDefault();
    }

    @Test
    void detect_reportsTwoFileImportCycle() {
        Node a = node(NodeKind.FILE, "app/a.py", "app/a.py");
        Node b = node(NodeKind.FILE, "app/b.py", "app/b.py");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(a).addNode(b)
                .addEdge(edge(a, b, EdgeKind.IMPORTS))
                .addEdge(edge(b, a, EdgeKind.IMPORTS))
                .build();

        List<IntegrityFinding> findings = detect(graph);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.kind()).isEqualTo(FindingKind.CYCLE);
            assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(finding.nodeIds()).containsExactlyInAnyOrder(a.id(), b.id());
            assertThat(finding.evidenceEdges()).hasSize(2);
            assertThat(finding.description()).contains("2 nodes", "app/a.py", "app/b.py");
            assertThat(finding.detectorId()).isEqualTo("cycle");
        });
    }

    @Test
    void detect_reportsThreeFileImportCycleOnce() {
        Node a = node(NodeKind.FILE, "app/a.py", "app/a.py");
        Node b = node(NodeKind.FILE, "app/b.py", "app/b.py");
        Node c = node(NodeKind.FILE, "app/c.py", "app/c.py");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(a).addNode(b).addNode(c)
                .addEdge(edge(a, b, EdgeKind.IMPORTS))
                .addEdge(edge(b, c, EdgeKind.IMPORTS))
                .addEdge(edge(c, a, EdgeKind.IMPORTS))
                .build();

        assertThat(detect(graph)).singleElement().satisfies(finding -> {
            assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(finding.nodeIds()).containsExactlyInAnyOrder(a.id(), b.id(), c.id());
            assertThat(finding.evidenceEdges()).hasSize(3);
        });
    }

    @Test
    void detect_ratesLargeCyclesHigh() {
        Node a = function("svc.a");
        Node b = function("svc.b");
        Node c = function("svc.c");
        Node d = function("svc.d");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(a).addNode(b).addNode(c).addNode(d)
                .addEdge(edge(a, b, EdgeKind.CALLS))
                .addEdge(edge(b, c, EdgeKind.CALLS))
                .addEdge(edge(c, d, EdgeKind.IMPORTS))
                .addEdge(edge(d, a, EdgeKind.CALLS))
                .build();

        assertThat(detect(graph)).singleElement()
                .satisfies(f -> assertThat(f.severity()).isEqualTo(Severity.HIGH));
    }

    @Test
    void detect_reportsDirectRecursionAsLow() {
        Node fact = function("math.factorial");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(fact)
                .addEdge(edge(fact, fact, EdgeKind.CALLS))
                .build();

        assertThat(detect(graph)).singleElement().satisfies(finding -> {
            assertThat(finding.severity()).isEqualTo(Severity.LOW);
            assertThat(finding.description()).startsWith("Recursive call");
        });
    }

    @Test
    void detect_ignoresSchemaAndBindingEdges() {
        Node a = function("svc.a");
        Node b = function("svc.b");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(a).addNode(b)
                .addEdge(edge(a, b, EdgeKind.REFERENCES_SCHEMA))
                .addEdge(edge(b, a, EdgeKind.BINDS_ENDPOINT))
                .build();

        assertThat(detect(graph)).isEmpty();
    }

    @Test
    void detect_findsNothingInAcyclicGraph() {
        Node a = function("svc.a");
        Node b = function("svc.b");
        Node c = function("svc.c");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(a).addNode(b).addNode(c)
                .addEdge(edge(a, b, EdgeKind.CALLS))
                .addEdge(edge(a, c, EdgeKind.CALLS))
                .addEdge(edge(b, c, EdgeKind.CALLS))
                .build();

        assertThat(detect(graph)).isEmpty();
    }

    @Test
    void detect_separatesIndependentCycles() {
        Node a = function("one.a");
        Node b = function("one.b");
        Node x = function("two.x");
        Node y = function("two.y");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(a).addNode(b).addNode(x).addNode(y)
                .addEdge(edge(a, b, EdgeKind.CALLS))
                .addEdge(edge(b, a, EdgeKind.CALLS))
                .addEdge(edge(x, y, EdgeKind.CALLS))
                .addEdge(edge(y, x, EdgeKind.CALLS))
                .addEdge(edge(b, x, EdgeKind.CALLS))
                .build();

        assertThat(detect(graph)).hasSize(2)
                .allSatisfy(f -> assertThat(f.nodeIds()).hasSize(2));
    }

    @Test
    void stronglyConnectedComponents_handlesLongChainsWithoutRecursion() {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        Node previous = null;
        Node first = null;
        for (int i = 0; i < 20_000; i++) {
            Node current = function("chain.n" + i);
            builder.addNode(current);
            if (previous != null) {
                builder.addEdge(edge(previous, current, EdgeKind.CALLS));
            } else {
                first = current;
            }
            previous = current;
        }
        builder.addEdge(edge(previous, first, EdgeKind.CALLS));

        List<List<String>> components = detector.stronglyConnectedComponents(builder.build(),
                CancellationToken.none());

        assertThat(components).singleElement().satisfies(c -> assertThat(c).hasSize(20_000));
    }

    @Test
    void detect_stopsWhenCancelled() {
        Node a = function("svc.a");
        DependencyGraph graph = DependencyGraph.builder().addNode(a).build();
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> detector.detect(graph, config, token))
                .isInstanceOf(AnalysisCancelledException.class);
    }

    private List<IntegrityFinding> detect(DependencyGraph graph) {
        return detector.detect(graph, config, CancellationToken.none());
    }
}
