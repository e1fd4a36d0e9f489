package io.devguard.detectors;

import io.devguard.config.AnalysisConfig;
import io.devguard.engine.CancellationToken;
import io.devguard.graph.DependencyGraph;
import io.devguard.model.Edge;
import io.devguard.model.EdgeKind;
import io.devguard.model.FindingKind;
import io.devguard.model.IntegrityFinding;
import io.devguard.model.Node;
import io.devguard.model.Severity;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Detects dependency cycles over Imports and Calls edges.
 * <p>
 * Uses Tarjan's strongly connected components algorithm with an explicit stack, so
 * deep graphs cannot overflow the call stack. Every component with more than one
 * node is a cycle, as is a single node that calls itself. Severity grows with the
 * size of the component.
 */
public class CycleDetector implements Detector {

    private static final Set<EdgeKind> CYCLE_EDGES = EnumSet.of(EdgeKind.IMPORTS, EdgeKind.CALLS);

    @Override
    public String id() {
        return "cycle";
    }

    @Override
    public String description() {
        return "Detects circular import and call dependencies";
    }

    @Override
    public FindingKind kind() {
        return FindingKind.CYCLE;
    }

    @Override
    public List<IntegrityFinding> detect(DependencyGraph graph, AnalysisConfig config,
                                         CancellationToken cancellation) {
        List<IntegrityFinding> findings = new ArrayList<>();
        for (List<String> component : stronglyConnectedComponents(graph, cancellation)) {
            Set<String> members = new HashSet<>(component);
            List<Edge> evidence = component.stream()
                    .flatMap(id -> graph.outgoing(id).stream())
                    .filter(e -> CYCLE_EDGES.contains(e.kind()) && members.contains(e.targetId()))
                    .toList();
            boolean selfCall = component.size() == 1 && evidence.stream()
                    .anyMatch(e -> e.kind() == EdgeKind.CALLS && e.isSelfLoop());
            if (component.size() > 1 || selfCall) {
                findings.add(createFinding(graph, component, evidence));
            }
        }
        findings.sort(Comparator.comparing(IntegrityFinding::primaryNodeId));
        return findings;
    }

    /**
     * Returns every strongly connected component of the Imports+Calls subgraph,
     * singletons included, in discovery order.
     */
    List<List<String>> stronglyConnectedComponents(DependencyGraph graph, CancellationToken cancellation) {
        record Frame(String node, List<String> successors, int[] next) {}

        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Set<String> onStack = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        List<List<String>> components = new ArrayList<>();
        int counter = 0;

        for (Node start : graph.nodes()) {
            if (index.containsKey(start.id())) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            index.put(start.id(), counter);
            lowLink.put(start.id(), counter++);
            stack.push(start.id());
            onStack.add(start.id());
            work.push(new Frame(start.id(), successors(graph, start.id()), new int[1]));

            while (!work.isEmpty()) {
                cancellation.throwIfCancelled();
                Frame frame = work.peek();
                String v = frame.node();
                if (frame.next()[0] < frame.successors().size()) {
                    String w = frame.successors().get(frame.next()[0]++);
                    if (!index.containsKey(w)) {
                        index.put(w, counter);
                        lowLink.put(w, counter++);
                        stack.push(w);
                        onStack.add(w);
                        work.push(new Frame(w, successors(graph, w), new int[1]));
                    } else if (onStack.contains(w)) {
                        lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
                    }
                    continue;
                }

                work.pop();
                if (lowLink.get(v).equals(index.get(v))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(v));
                    Collections.sort(component);
                    components.add(component);
                }
                if (!work.isEmpty()) {
                    String parent = work.peek().node();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(v)));
                }
            }
        }
        return components;
    }

    private static List<String> successors(DependencyGraph graph, String id) {
        return graph.outgoing(id).stream()
                .filter(e -> CYCLE_EDGES.contains(e.kind()))
                .map(Edge::targetId)
                .distinct()
                .toList();
    }

    private IntegrityFinding createFinding(DependencyGraph graph, List<String> component, List<Edge> evidence) {
        Severity severity;
        if (component.size() == 1) {
            severity = Severity.LOW;
        } else if (component.size() <= 3) {
            severity = Severity.MEDIUM;
        } else {
            severity = Severity.HIGH;
        }

        String names = component.stream()
                .map(id -> graph.node(id).map(Node::qualifiedName).orElse(id))
                .sorted()
                .collect(Collectors.joining(", "));
        String description = component.size() == 1
                ? "Recursive call: " + names
                : "Dependency cycle between " + component.size() + " nodes: " + names;

        return IntegrityFinding.builder()
                .kind(FindingKind.CYCLE)
                .severity(severity)
                .nodeIds(component)
                .evidenceEdges(evidence)
                .description(description)
                .detectorId(id())
                .build();
    }
}
