package io.devguard.model;

import java.util.List;

/**
 * A structural or production-readiness issue found in a graph snapshot.
 *
 * @param kind           detector category
 * @param severity       how urgent the issue is
 * @param nodeIds        implicated nodes, sorted
 * @param evidenceEdges  edges supporting the finding (cycles, coupling)
 * @param matchedPattern rule or pattern that matched (production risk, entry-point checks)
 * @param description    human-inspectable summary
 * @param detectorId     id of the detector that produced the finding
 * @param location       file location for text-based findings, null otherwise
 */
public record IntegrityFinding(
        FindingKind kind,
        Severity severity,
        List<String> nodeIds,
        List<Edge> evidenceEdges,
        String matchedPattern,
        String description,
        String detectorId,
        String location
) {

    public IntegrityFinding {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (nodeIds == null || nodeIds.isEmpty()) {
            throw new IllegalArgumentException("a finding must implicate at least one node");
        }
        nodeIds = nodeIds.stream().sorted().distinct().toList();
        evidenceEdges = evidenceEdges == null ? List.of() : List.copyOf(evidenceEdges);
    }

    /**
     * Returns the first implicated node id, used for stable ordering.
     */
    public String primaryNodeId() {
        return nodeIds.get(0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private FindingKind kind;
        private Severity severity;
        private List<String> nodeIds = List.of();
        private List<Edge> evidenceEdges = List.of();
        private String matchedPattern;
        private String description;
        private String detectorId;
        private String location;

        public Builder kind(FindingKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder nodeIds(List<String> nodeIds) {
            this.nodeIds = nodeIds;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeIds = List.of(nodeId);
            return this;
        }

        public Builder evidenceEdges(List<Edge> evidenceEdges) {
            this.evidenceEdges = evidenceEdges;
            return this;
        }

        public Builder matchedPattern(String matchedPattern) {
            this.matchedPattern = matchedPattern;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder detectorId(String detectorId) {
            this.detectorId = detectorId;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public IntegrityFinding build() {
            return new IntegrityFinding(kind, severity, nodeIds, evidenceEdges,
                    matchedPattern, description, detectorId, location);
        }
    }
}
