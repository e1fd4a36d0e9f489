package io.devguard.model;

/**
 * A typed, directed relationship between two nodes.
 *
 * @param sourceId   id of the depending node
 * @param targetId   id of the node depended upon
 * @param kind       relationship type
 * @param confidence 1.0 for syntactic matches, lower for heuristic ones
 * @param provenance file and line span of the statement that implied the edge
 */
public record Edge(
        String sourceId,
        String targetId,
        EdgeKind kind,
        double confidence,
        Provenance provenance
) {

    public Edge {
        if (sourceId == null || targetId == null) {
            throw new IllegalArgumentException("edge endpoints cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    /**
     * Key identifying duplicates: edges with the same key are merged.
     */
    public Key key() {
        return new Key(sourceId, targetId, kind);
    }

    public boolean isSelfLoop() {
        return sourceId.equals(targetId);
    }

    public record Key(String sourceId, String targetId, EdgeKind kind) {}
}
