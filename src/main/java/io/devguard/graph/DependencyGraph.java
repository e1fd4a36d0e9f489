package io.devguard.graph;

import io.devguard.extract.FileContribution.RiskScan;
import io.devguard.model.Edge;
import io.devguard.model.Node;
import io.devguard.model.UnparsedFile;
import io.devguard.model.UnresolvedReference;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The merged cross-stack dependency graph.
 * <p>
 * Immutable: nodes, edges and both adjacency indices are copied on construction.
 * Every edge's endpoints exist in the node map. Iteration orders are sorted, so two
 * graphs built from the same documents enumerate identically.
 */
public final class DependencyGraph {

    private static final Comparator<Node> NODE_ORDER = Comparator
            .comparing(Node::path)
            .thenComparingInt(Node::line)
            .thenComparing(Node::qualifiedName);

    static final Comparator<Edge> EDGE_ORDER = Comparator
            .comparing(Edge::sourceId)
            .thenComparing(Edge::targetId)
            .thenComparing(Edge::kind);

    private final Map<String, Node> nodes;
    private final List<Node> orderedNodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, List<Edge>> incoming;
    private final Map<String, List<Node>> byQualifiedName;
    private final List<UnparsedFile> unparsedFiles;
    private final List<UnresolvedReference> unresolvedReferences;
    private final Map<String, RiskScan> riskScans;
    private final int totalFiles;

    private DependencyGraph(Builder builder) {
        this.orderedNodes = builder.nodes.values().stream().sorted(NODE_ORDER).toList();
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(
                orderedNodes.stream().collect(Collectors.toMap(Node::id, n -> n, (a, b) -> a, LinkedHashMap::new))));
        this.edges = builder.edges.values().stream().sorted(EDGE_ORDER).toList();

        Map<String, List<Edge>> out = new HashMap<>();
        Map<String, List<Edge>> in = new HashMap<>();
        for (Edge edge : edges) {
            if (!nodes.containsKey(edge.sourceId()) || !nodes.containsKey(edge.targetId())) {
                throw new IllegalStateException("Edge endpoint missing from graph: " + edge);
            }
            out.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.targetId(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = deepCopyListMap(out);
        this.incoming = deepCopyListMap(in);
        this.byQualifiedName = deepCopyListMap(orderedNodes.stream()
                .collect(Collectors.groupingBy(Node::qualifiedName)));

        this.unparsedFiles = builder.unparsedFiles.stream()
                .sorted(Comparator.comparing(UnparsedFile::path))
                .toList();
        this.unresolvedReferences = builder.unresolved.stream()
                .sorted(Comparator.comparing((UnresolvedReference u) -> u.provenance().path())
                        .thenComparingInt(u -> u.provenance().startLine())
                        .thenComparing(UnresolvedReference::sourceId)
                        .thenComparing(UnresolvedReference::targetName)
                        .thenComparing(UnresolvedReference::kind))
                .toList();
        this.riskScans = Collections.unmodifiableMap(new TreeMap<>(builder.riskScans));
        this.totalFiles = Math.max(builder.totalFiles, riskScans.size() + unparsedFiles.size());
    }

    private static <K, V> Map<K, List<V>> deepCopyListMap(Map<K, List<V>> original) {
        return original.entrySet().stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        e -> List.copyOf(e.getValue())
                ));
    }

    public static DependencyGraph empty() {
        return builder().build();
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    /**
     * Returns all nodes ordered by path, line and qualified name.
     */
    public List<Node> nodes() {
        return orderedNodes;
    }

    /**
     * Returns all edges ordered by source id, target id and kind.
     */
    public List<Edge> edges() {
        return edges;
    }

    public List<Edge> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<Edge> incoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns the nodes with the given qualified name, possibly from several files.
     */
    public List<Node> findByQualifiedName(String qualifiedName) {
        return byQualifiedName.getOrDefault(qualifiedName, List.of());
    }

    public List<UnparsedFile> unparsedFiles() {
        return unparsedFiles;
    }

    public List<UnresolvedReference> unresolvedReferences() {
        return unresolvedReferences;
    }

    /**
     * Raw-text scan results of every parsed file, keyed by path.
     */
    public Map<String, RiskScan> riskScans() {
        return riskScans;
    }

    public int totalFiles() {
        return totalFiles;
    }

    public int parsedFiles() {
        return totalFiles - unparsedFiles.size();
    }

    /**
     * Fraction of input files that were parsed successfully, 1.0 for an empty batch.
     */
    public double coverage() {
        return totalFiles == 0 ? 1.0 : (double) parsedFiles() / totalFiles;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates graph content. Duplicate edges (same source, target and kind) keep the
     * highest confidence; ties keep the first provenance added.
     */
    public static class Builder {
        private final Map<String, Node> nodes = new HashMap<>();
        private final Map<Edge.Key, Edge> edges = new HashMap<>();
        private final List<UnparsedFile> unparsedFiles = new ArrayList<>();
        private final List<UnresolvedReference> unresolved = new ArrayList<>();
        private final Map<String, RiskScan> riskScans = new HashMap<>();
        private int totalFiles;

        public Builder addNode(Node node) {
            Node existing = nodes.putIfAbsent(node.id(), node);
            if (existing != null && !existing.equals(node)) {
                throw new IllegalArgumentException("Conflicting declarations for node id " + node.id());
            }
            return this;
        }

        public Builder addEdge(Edge edge) {
            edges.merge(edge.key(), edge, (current, candidate) ->
                    candidate.confidence() > current.confidence() ? candidate : current);
            return this;
        }

        public Builder addUnparsed(UnparsedFile file) {
            unparsedFiles.add(file);
            return this;
        }

        public Builder addUnresolved(UnresolvedReference reference) {
            unresolved.add(reference);
            return this;
        }

        public Builder addRiskScan(RiskScan scan) {
            riskScans.put(scan.path(), scan);
            return this;
        }

        public Builder totalFiles(int totalFiles) {
            this.totalFiles = totalFiles;
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(this);
        }
    }
}
