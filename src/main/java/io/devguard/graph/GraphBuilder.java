package io.devguard.graph;

import io.devguard.config.AnalysisConfig;
import io.devguard.extract.Declaration;
import io.devguard.extract.FileContribution;
import io.devguard.extract.HttpCall;
import io.devguard.extract.SymbolReference;
import io.devguard.graph.EndpointBinder.RouteTarget;
import io.devguard.model.Edge;
import io.devguard.model.EdgeKind;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import io.devguard.model.UnparsedFile;
import io.devguard.model.UnresolvedReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-file contributions into one {@link DependencyGraph}.
 * <p>
 * Resolution of a reference tries each of its candidate names against the global
 * qualified-name index (declared names and aliases), then against the dotted-suffix
 * index. A unique match yields confidence 1.0. When several nodes share the name,
 * the one closest to the referencing file wins (longest common directory prefix,
 * then same top-level directory, then smallest id) with the configured ambiguous
 * confidence. References that resolve nowhere are dropped and reported as
 * {@link UnresolvedReference} diagnostics.
 * <p>
 * Contributions are processed in path order, so the result does not depend on the
 * order in which files were extracted.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final AnalysisConfig config;

    public GraphBuilder(AnalysisConfig config) {
        this.config = config;
    }

    public DependencyGraph build(List<FileContribution> contributions, List<UnparsedFile> unparsed) {
        List<FileContribution> ordered = contributions.stream()
                .sorted(Comparator.comparing(FileContribution::path))
                .toList();

        DependencyGraph.Builder graph = DependencyGraph.builder()
                .totalFiles(contributions.size() + unparsed.size());
        unparsed.forEach(graph::addUnparsed);

        NameIndex index = new NameIndex();
        List<RouteTarget> routes = new ArrayList<>();
        List<HttpCall> calls = new ArrayList<>();
        for (FileContribution contribution : ordered) {
            for (Declaration declaration : contribution.declarations()) {
                graph.addNode(declaration.node());
                index.add(declaration);
                if (declaration.route() != null) {
                    routes.add(new RouteTarget(declaration.node(), declaration.route()));
                }
            }
            calls.addAll(contribution.httpCalls());
            graph.addRiskScan(contribution.riskScan());
        }

        Map<String, String> pathOfNode = new HashMap<>();
        ordered.forEach(c -> c.declarations().forEach(d -> pathOfNode.put(d.node().id(), c.path())));

        int resolved = 0;
        int dropped = 0;
        for (FileContribution contribution : ordered) {
            for (SymbolReference reference : contribution.references()) {
                Resolution resolution = resolve(index, reference, pathOfNode.getOrDefault(reference.sourceId(),
                        contribution.path()));
                if (resolution == null) {
                    graph.addUnresolved(new UnresolvedReference(reference.sourceId(), reference.targetName(),
                            reference.kind(), reference.provenance()));
                    dropped++;
                    continue;
                }
                Node target = resolution.node();
                if (reference.kind() == EdgeKind.IMPORTS && target.id().equals(reference.sourceId())) {
                    continue;
                }
                if (reference.kind() == EdgeKind.REFERENCES_SCHEMA && target.kind() != NodeKind.SCHEMA) {
                    continue;
                }
                graph.addEdge(new Edge(reference.sourceId(), target.id(), reference.kind(),
                        resolution.confidence(), reference.provenance()));
                resolved++;
            }
        }

        EndpointBinder.Result binding = new EndpointBinder(config.binding()).bind(routes, calls);
        binding.edges().forEach(graph::addEdge);
        binding.unresolved().forEach(graph::addUnresolved);

        DependencyGraph result = graph.build();
        log.info("Built graph: {} nodes, {} edges, {} endpoint bindings, {} unresolved references",
                result.nodeCount(), result.edgeCount(), binding.edges().size(), dropped + binding.unresolved().size());
        log.debug("Resolved {} references across {} files", resolved, ordered.size());
        return result;
    }

    private record Resolution(Node node, double confidence) {}

    private Resolution resolve(NameIndex index, SymbolReference reference, String sourcePath) {
        for (String candidate : reference.candidates()) {
            List<Node> exact = index.exact(candidate);
            if (!exact.isEmpty()) {
                return pick(exact, sourcePath);
            }
        }
        for (String candidate : reference.candidates()) {
            List<Node> suffix = index.suffix(candidate);
            if (!suffix.isEmpty()) {
                return pick(suffix, sourcePath);
            }
        }
        return null;
    }

    private Resolution pick(List<Node> matches, String sourcePath) {
        if (matches.size() == 1) {
            return new Resolution(matches.get(0), 1.0);
        }
        Node best = matches.stream()
                .min(Comparator.comparingInt((Node n) -> -commonDirectoryDepth(sourcePath, n.path()))
                        .thenComparingInt(n -> sameTopLevel(sourcePath, n.path()) ? 0 : 1)
                        .thenComparing(Node::id))
                .orElseThrow();
        return new Resolution(best, config.resolution().ambiguousConfidence());
    }

    static int commonDirectoryDepth(String a, String b) {
        String[] left = directories(a);
        String[] right = directories(b);
        int depth = 0;
        while (depth < left.length && depth < right.length && left[depth].equals(right[depth])) {
            depth++;
        }
        return depth;
    }

    static boolean sameTopLevel(String a, String b) {
        String[] left = directories(a);
        String[] right = directories(b);
        if (left.length == 0 || right.length == 0) {
            return left.length == right.length;
        }
        return left[0].equals(right[0]);
    }

    private static String[] directories(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? new String[0] : path.substring(0, slash).split("/");
    }

    /**
     * Qualified-name and dotted-suffix lookup over every declared node.
     */
    private static final class NameIndex {
        private final Map<String, List<Node>> exact = new HashMap<>();
        private final Map<String, List<Node>> suffixes = new HashMap<>();

        void add(Declaration declaration) {
            Node node = declaration.node();
            put(exact, node.qualifiedName(), node);
            for (String alias : declaration.aliases()) {
                put(exact, alias, node);
            }
            addSuffixes(node.qualifiedName(), node);
            for (String alias : declaration.aliases()) {
                addSuffixes(alias, node);
            }
        }

        private void addSuffixes(String name, Node node) {
            if (name.contains("/") || name.contains(" ")) {
                return;
            }
            int dot = name.indexOf('.');
            while (dot >= 0) {
                put(suffixes, name.substring(dot + 1), node);
                dot = name.indexOf('.', dot + 1);
            }
        }

        List<Node> exact(String name) {
            return exact.getOrDefault(name, List.of());
        }

        /**
         * Suffix matches; a single-segment name only matches files and modules.
         */
        List<Node> suffix(String name) {
            List<Node> matches = suffixes.getOrDefault(name, List.of());
            if (name.contains(".")) {
                return matches;
            }
            return matches.stream()
                    .filter(n -> n.kind() == NodeKind.FILE || n.kind() == NodeKind.MODULE)
                    .toList();
        }

        private static void put(Map<String, List<Node>> map, String key, Node node) {
            List<Node> nodes = map.computeIfAbsent(key, k -> new ArrayList<>());
            if (!nodes.contains(node)) {
                nodes.add(node);
            }
        }
    }
}
