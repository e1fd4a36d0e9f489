package io.devguard.model;

import java.util.List;

/**
 * Blast radius of a change: affected nodes ordered by distance, then by
 * confidence descending, then by id.
 *
 * @param change          the simulated change
 * @param snapshotVersion snapshot the simulation ran against
 * @param entries         affected nodes, never containing the target itself
 */
public record ImpactResult(ChangeSpec change, long snapshotVersion, List<ImpactEntry> entries) {

    public ImpactResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<String> nodeIds() {
        return entries.stream().map(ImpactEntry::nodeId).toList();
    }
}
