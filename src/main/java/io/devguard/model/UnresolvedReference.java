package io.devguard.model;

/**
 * Diagnostic for a reference the graph builder could not resolve to a node.
 * The corresponding edge is dropped.
 *
 * @param sourceId   node that made the reference
 * @param targetName textual name that was looked up
 * @param kind       kind of the dropped edge
 * @param provenance where the reference appears
 */
public record UnresolvedReference(
        String sourceId,
        String targetName,
        EdgeKind kind,
        Provenance provenance
) {}
