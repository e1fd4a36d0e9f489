package io.devguard.impact;

import io.devguard.engine.AnalysisCancelledException;
import io.devguard.engine.CancellationToken;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.ChangeSpec;
import io.devguard.model.EdgeKind;
import io.devguard.model.ImpactEntry;
import io.devguard.model.ImpactResult;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.devguard.TestGraphs.edge;
import static io.devguard.TestGraphs.function;
import static io.devguard.TestGraphs.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class BlastRadiusSimulatorTest {

    private BlastRadiusSimulator simulator;
    private Node target;

    @BeforeEach
    void setUp() {
        simulator = new BlastRadiusSimulator(0);
        target = function("core.target");
    }

    @Test
    void simulate_walksCallersWithMinimumConfidence() throws Exception {
        Node a = function("svc.a");
        Node b = function("svc.b");
        Node c = function("svc.c");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(target).addNode(a).addNode(b).addNode(c)
                .addEdge(edge(a, target, EdgeKind.CALLS))
                .addEdge(edge(b, a, EdgeKind.CALLS, 0.6))
                .addEdge(edge(c, b, EdgeKind.CALLS, 0.9))
                .build();

        ImpactResult result = simulator.simulate(graph, 3, ChangeSpec.rename(target.id()), CancellationToken.none());

        assertThat(result.snapshotVersion()).isEqualTo(3);
        assertThat(result.entries())
                .extracting(ImpactEntry::nodeId, ImpactEntry::distance, ImpactEntry::confidence)
                .containsExactly(
                        tuple(a.id(), 1, 1.0),
                        tuple(b.id(), 2, 0.6),
                        tuple(c.id(), 3, 0.6));
    }

    @Test
    void simulate_reportsShortestDistance() throws Exception {
        Node a = function("svc.a");
        Node direct = function("svc.direct");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(target).addNode(a).addNode(direct)
                .addEdge(edge(a, target, EdgeKind.CALLS))
                .addEdge(edge(direct, a, EdgeKind.CALLS))
                .addEdge(edge(direct, target, EdgeKind.CALLS, 0.8))
                .build();

        ImpactResult result = simulator.simulate(graph, 1, ChangeSpec.remove(target.id()), CancellationToken.none());

        assertThat(result.entries())
                .extracting(ImpactEntry::nodeId, ImpactEntry::distance, ImpactEntry::confidence)
                .containsExactly(
                        tuple(a.id(), 1, 1.0),
                        tuple(direct.id(), 1, 0.8));
    }

    @Test
    void simulate_keepsBestConfidenceAmongEquallyShortPaths() throws Exception {
        Node p = function("svc.p");
        Node q = function("svc.q");
        Node x = function("svc.x");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(target).addNode(p).addNode(q).addNode(x)
                .addEdge(edge(p, target, EdgeKind.CALLS, 0.7))
                .addEdge(edge(q, target, EdgeKind.CALLS, 0.9))
                .addEdge(edge(x, p, EdgeKind.CALLS))
                .addEdge(edge(x, q, EdgeKind.CALLS, 0.95))
                .build();

        ImpactResult result = simulator.simulate(graph, 1, ChangeSpec.remove(target.id()), CancellationToken.none());

        assertThat(result.entries())
                .extracting(ImpactEntry::nodeId, ImpactEntry::distance, ImpactEntry::confidence)
                .containsExactly(
                        tuple(q.id(), 1, 0.9),
                        tuple(p.id(), 1, 0.7),
                        tuple(x.id(), 2, 0.9));
    }

    @Test
    void simulate_terminatesOnCyclesAndExcludesTarget() throws Exception {
        Node a = function("svc.a");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(target).addNode(a)
                .addEdge(edge(a, target, EdgeKind.CALLS))
                .addEdge(edge(target, a, EdgeKind.CALLS))
                .addEdge(edge(target, target, EdgeKind.CALLS))
                .build();

        ImpactResult result = simulator.simulate(graph, 1, ChangeSpec.remove(target.id()), CancellationToken.none());

        assertThat(result.nodeIds()).containsExactly(a.id());
    }

    @Test
    void rename_followsImportsOnlyIntoTheRenamedNode() throws Exception {
        Node user = node(NodeKind.SCHEMA, "app/models.py", "app.models.User");
        Node services = node(NodeKind.FILE, "app/services.py", "app/services.py");
        Node loadUser = node(NodeKind.FUNCTION, "app/services.py", "app.services.load_user");
        Node api = node(NodeKind.FILE, "app/api.py", "app/api.py");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(user).addNode(services).addNode(loadUser).addNode(api)
                .addEdge(edge(services, user, EdgeKind.IMPORTS))
                .addEdge(edge(loadUser, user, EdgeKind.REFERENCES_SCHEMA))
                .addEdge(edge(api, services, EdgeKind.IMPORTS))
                .build();

        ImpactResult renamed = simulator.simulate(graph, 1, ChangeSpec.rename(user.id()), CancellationToken.none());
        ImpactResult removed = simulator.simulate(graph, 1, ChangeSpec.remove(user.id()), CancellationToken.none());

        assertThat(renamed.nodeIds()).containsExactlyInAnyOrder(services.id(), loadUser.id());
        assertThat(removed.entries())
                .extracting(ImpactEntry::nodeId, ImpactEntry::distance)
                .contains(tuple(api.id(), 2));
    }

    @Test
    void signatureChange_followsCallsAndBindingsOnly() throws Exception {
        Node endpoint = node(NodeKind.ENDPOINT, "app/routes.py", "GET /users");
        Node caller = function("svc.caller");
        Node typed = function("svc.typed");
        Node client = node(NodeKind.FUNCTION, "web/api.js", "web.api.listUsers");
        Node importer = node(NodeKind.FILE, "app/main.py", "app/main.py");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(target).addNode(endpoint).addNode(caller).addNode(typed).addNode(client).addNode(importer)
                .addEdge(edge(endpoint, target, EdgeKind.CALLS))
                .addEdge(edge(client, endpoint, EdgeKind.BINDS_ENDPOINT, 0.9))
                .addEdge(edge(caller, target, EdgeKind.CALLS))
                .addEdge(edge(typed, target, EdgeKind.REFERENCES_SCHEMA))
                .addEdge(edge(importer, target, EdgeKind.IMPORTS))
                .build();

        ImpactResult result = simulator.simulate(graph, 1, ChangeSpec.signatureChange(target.id()),
                CancellationToken.none());

        assertThat(result.nodeIds()).containsExactlyInAnyOrder(endpoint.id(), caller.id(), client.id());
        assertThat(result.entries()).filteredOn(e -> e.nodeId().equals(client.id()))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.distance()).isEqualTo(2);
                    assertThat(e.confidence()).isEqualTo(0.9);
                });
    }

    @Test
    void simulate_stopsAtMaxDepth() throws Exception {
        Node a = function("svc.a");
        Node b = function("svc.b");
        Node c = function("svc.c");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(target).addNode(a).addNode(b).addNode(c)
                .addEdge(edge(a, target, EdgeKind.CALLS))
                .addEdge(edge(b, a, EdgeKind.CALLS))
                .addEdge(edge(c, b, EdgeKind.CALLS))
                .build();

        ImpactResult result = new BlastRadiusSimulator(2)
                .simulate(graph, 1, ChangeSpec.remove(target.id()), CancellationToken.none());

        assertThat(result.nodeIds()).containsExactly(a.id(), b.id());
    }

    @Test
    void simulate_returnsEmptyResultForUnreferencedTarget() throws Exception {
        Node helper = function("core.helper");
        Node models = node(NodeKind.FILE, "core/models.py", "core/models.py");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(target).addNode(helper).addNode(models)
                .addEdge(edge(target, helper, EdgeKind.CALLS))
                .addEdge(edge(target, models, EdgeKind.IMPORTS))
                .addEdge(edge(helper, models, EdgeKind.REFERENCES_SCHEMA))
                .build();

        ImpactResult result = simulator.simulate(graph, 1, ChangeSpec.remove(target.id()), CancellationToken.none());

        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    void simulate_rejectsUnknownTarget() {
        DependencyGraph graph = DependencyGraph.builder().addNode(target).build();

        assertThatThrownBy(() -> simulator.simulate(graph, 4, ChangeSpec.rename("nope"), CancellationToken.none()))
                .isInstanceOf(NodeNotFoundException.class)
                .hasMessage("Node not found in snapshot v4: nope")
                .satisfies(e -> assertThat(((NodeNotFoundException) e).nodeId()).isEqualTo("nope"));
    }

    @Test
    void simulate_stopsWhenCancelled() {
        Node a = function("svc.a");
        DependencyGraph graph = DependencyGraph.builder()
                .addNode(target).addNode(a)
                .addEdge(edge(a, target, EdgeKind.CALLS))
                .build();
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> simulator.simulate(graph, 1, ChangeSpec.remove(target.id()), token))
                .isInstanceOf(AnalysisCancelledException.class);
    }

    @Test
    void constructor_rejectsNegativeDepth() {
        assertThatThrownBy(() -> new BlastRadiusSimulator(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
