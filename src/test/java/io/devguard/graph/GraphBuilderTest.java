package io.devguard.graph;

import io.devguard.config.AnalysisConfig;
import io.devguard.extract.ExtractionOutcome;
import io.devguard.extract.ExtractorRegistry;
import io.devguard.extract.FileContribution;
import io.devguard.model.Edge;
import io.devguard.model.EdgeKind;
import io.devguard.model.Node;
import io.devguard.model.NodeIds;
import io.devguard.model.SourceDocument;
import io.devguard.model.UnparsedFile;
import io.devguard.model.UnresolvedReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class GraphBuilderTest {

    private static final SourceDocument MODELS = SourceDocument.of("backend/app/models.py", """
            from pydantic import BaseModel


            class User(BaseModel):
                id: int
                name: str
            """);

    private static final SourceDocument SERVICES = SourceDocument.of("backend/app/services.py", """
            from .models import User


            def load_user(user_id: int) -> User:
                return User(id=user_id, name="Ada")
            """);

    private static final SourceDocument ROUTES = SourceDocument.of("backend/app/routes.py", """
            from fastapi import APIRouter

            from .services import load_user

            router = APIRouter(prefix="/users")


            @router.get("/{user_id}")
            def get_user(user_id: int):
                return load_user(user_id)
            """);

    private static final SourceDocument API = SourceDocument.of("frontend/src/api.js", """
            export async function fetchUser(id) {
              const response = await fetch(`/api/users/${id}`);
              return response.json();
            }
            """);

    private static final SourceDocument BROKEN = SourceDocument.of("broken/bad.py", "x = (1, 2\n");

    private ExtractorRegistry extractors;
    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        extractors = ExtractorRegistry.createDefault();
        builder = new GraphBuilder(AnalysisConfig.loadDefault());
    }

    @Test
    void build_resolvesReferencesAcrossFiles() {
        DependencyGraph graph = build(MODELS, SERVICES, ROUTES);

        Node user = single(graph, "backend.app.models.User");
        Node loadUser = single(graph, "backend.app.services.load_user");
        Node getUser = single(graph, "backend.app.routes.get_user");

        assertThat(edge(graph, loadUser, user, EdgeKind.REFERENCES_SCHEMA)).hasValueSatisfying(
                e -> assertThat(e.confidence()).isEqualTo(1.0));
        assertThat(edge(graph, loadUser, user, EdgeKind.CALLS)).isPresent();
        assertThat(edge(graph, getUser, loadUser, EdgeKind.CALLS)).isPresent();
        assertThat(edge(graph, single(graph, "backend/app/services.py"), user, EdgeKind.IMPORTS)).isPresent();
    }

    @Test
    void build_bindsFrontendCallToBackendEndpoint() {
        DependencyGraph graph = build(MODELS, SERVICES, ROUTES, API);

        Node endpoint = single(graph, "GET /users/{user_id}");
        Node fetchUser = single(graph, "frontend.src.api.fetchUser");

        assertThat(edge(graph, fetchUser, endpoint, EdgeKind.BINDS_ENDPOINT)).hasValueSatisfying(
                e -> assertThat(e.confidence()).isEqualTo(0.6));
        assertThat(edge(graph, endpoint, single(graph, "backend.app.routes.get_user"), EdgeKind.CALLS)).isPresent();
    }

    @Test
    void build_isIndependentOfContributionOrder() {
        List<FileContribution> contributions = contributions(MODELS, SERVICES, ROUTES, API);
        List<FileContribution> reversed = new ArrayList<>(contributions);
        Collections.reverse(reversed);

        DependencyGraph first = builder.build(contributions, List.of());
        DependencyGraph second = builder.build(reversed, List.of());

        assertThat(second.nodes()).isEqualTo(first.nodes());
        assertThat(second.edges()).isEqualTo(first.edges());
        assertThat(second.unresolvedReferences()).isEqualTo(first.unresolvedReferences());
    }

    @Test
    void build_derivesIdsFromPathAndQualifiedName() {
        DependencyGraph first = build(MODELS, SERVICES);
        DependencyGraph second = build(MODELS, SERVICES);

        Node user = single(first, "backend.app.models.User");
        assertThat(user.id()).isEqualTo(NodeIds.nodeId("backend/app/models.py", "backend.app.models.User"));
        assertThat(second.nodes()).extracting(Node::id).isEqualTo(first.nodes().stream().map(Node::id).toList());
    }

    @Test
    void build_reportsUnresolvedReferencesInsteadOfEdges() {
        DependencyGraph graph = build(MODELS);

        assertThat(graph.unresolvedReferences())
                .extracting(UnresolvedReference::targetName)
                .contains("pydantic.BaseModel");
        assertThat(graph.edges()).noneMatch(e -> e.kind() == EdgeKind.IMPLEMENTS);
    }

    @Test
    void build_leavesCallToMissingDefaultExportUnresolved() {
        DependencyGraph graph = build(
                SourceDocument.of("lib/util.js", "export function helper() {\n  return 1;\n}\n"),
                SourceDocument.of("web/b.js", "import util from '../lib/util';\n\nexport function go() {\n  return util();\n}\n"));

        Node go = single(graph, "web.b.go");
        Node webFile = single(graph, "web/b.js");
        Node utilFile = single(graph, "lib/util.js");

        assertThat(graph.outgoing(go.id())).isEmpty();
        assertThat(edge(graph, webFile, utilFile, EdgeKind.IMPORTS)).isPresent();
        assertThat(graph.unresolvedReferences())
                .extracting(UnresolvedReference::sourceId, UnresolvedReference::targetName, UnresolvedReference::kind)
                .contains(tuple(go.id(), "lib.util.default", EdgeKind.CALLS));
    }

    @Test
    void build_picksClosestCandidateForAmbiguousNames() {
        DependencyGraph graph = build(
                SourceDocument.of("a/utils.py", "def helper():\n    return 1\n"),
                SourceDocument.of("b/utils.py", "def helper():\n    return 2\n"),
                SourceDocument.of("a/main.py", "import utils\n\n\ndef main():\n    return utils.helper()\n"));

        Node main = single(graph, "a.main.main");
        Node nearHelper = single(graph, "a.utils.helper");

        assertThat(edge(graph, main, nearHelper, EdgeKind.CALLS)).hasValueSatisfying(
                e -> assertThat(e.confidence()).isEqualTo(0.8));
        assertThat(graph.outgoing(main.id())).hasSize(1);
    }

    @Test
    void build_dropsSchemaReferencesToNonSchemaNodes() {
        DependencyGraph graph = build(SourceDocument.of("app/wiring.py", """
                class Service:
                    pass


                def provide(service: Service) -> Service:
                    return service
                """));

        assertThat(graph.edges()).noneMatch(e -> e.kind() == EdgeKind.REFERENCES_SCHEMA);
        assertThat(graph.unresolvedReferences()).isEmpty();
    }

    @Test
    void build_dropsSelfImports() {
        DependencyGraph graph = build(SourceDocument.of("app/utils.py", "from app import utils\n"));

        assertThat(graph.edges()).isEmpty();
        assertThat(graph.unresolvedReferences()).isEmpty();
    }

    @Test
    void build_countsUnparsedFilesTowardsCoverage() {
        DependencyGraph graph = build(MODELS, SERVICES, ROUTES, BROKEN);

        assertThat(graph.totalFiles()).isEqualTo(4);
        assertThat(graph.parsedFiles()).isEqualTo(3);
        assertThat(graph.coverage()).isEqualTo(0.75);
        assertThat(graph.unparsedFiles()).extracting(UnparsedFile::path).containsExactly("broken/bad.py");
        assertThat(graph.nodes()).noneMatch(n -> n.path().startsWith("broken/"));
    }

    @Test
    void commonDirectoryDepth_countsSharedLeadingDirectories() {
        assertThat(GraphBuilder.commonDirectoryDepth("a/b/c.py", "a/b/d.py")).isEqualTo(2);
        assertThat(GraphBuilder.commonDirectoryDepth("a/b/c.py", "a/x/d.py")).isEqualTo(1);
        assertThat(GraphBuilder.commonDirectoryDepth("c.py", "a/d.py")).isZero();
        assertThat(GraphBuilder.sameTopLevel("a/b/c.py", "a/x/d.py")).isTrue();
        assertThat(GraphBuilder.sameTopLevel("a/c.py", "b/d.py")).isFalse();
    }

    private DependencyGraph build(SourceDocument... documents) {
        List<FileContribution> contributions = new ArrayList<>();
        List<UnparsedFile> unparsed = new ArrayList<>();
        for (SourceDocument document : documents) {
            ExtractionOutcome outcome = extractors.extract(document);
            if (outcome.isParsed()) {
                contributions.add(outcome.contribution());
            } else {
                unparsed.add(outcome.unparsed());
            }
        }
        return builder.build(contributions, unparsed);
    }

    private List<FileContribution> contributions(SourceDocument... documents) {
        List<FileContribution> contributions = new ArrayList<>();
        for (SourceDocument document : documents) {
            contributions.add(extractors.extract(document).contribution());
        }
        return contributions;
    }

    static Node single(DependencyGraph graph, String qualifiedName) {
        List<Node> matches = graph.findByQualifiedName(qualifiedName);
        assertThat(matches).as("nodes named %s", qualifiedName).hasSize(1);
        return matches.get(0);
    }

    static Optional<Edge> edge(DependencyGraph graph, Node source, Node target, EdgeKind kind) {
        return graph.outgoing(source.id()).stream()
                .filter(e -> e.targetId().equals(target.id()) && e.kind() == kind)
                .findFirst();
    }
}
