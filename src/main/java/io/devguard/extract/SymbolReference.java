package io.devguard.extract;

import io.devguard.model.EdgeKind;
import io.devguard.model.Provenance;

import java.util.List;

/**
 * An unresolved reference recorded by textual name.
 * <p>
 * Candidates are tried in order by the graph builder; the first one that resolves
 * wins. A default import of {@code ./api} for example yields
 * {@code [src.api.default, src.api]} so the edge falls back to the module.
 *
 * @param sourceId   node making the reference
 * @param candidates qualified names to try, most specific first
 * @param kind       kind of edge the reference implies
 * @param provenance where the reference appears
 */
public record SymbolReference(String sourceId, List<String> candidates, EdgeKind kind, Provenance provenance) {

    public SymbolReference {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("a reference needs at least one candidate name");
        }
        candidates = List.copyOf(candidates);
    }

    public String targetName() {
        return candidates.get(0);
    }
}
