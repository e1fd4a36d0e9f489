package io.devguard.model;

/**
 * One node affected by a simulated change.
 *
 * @param nodeId     affected node
 * @param distance   shortest number of reverse hops from the change target
 * @param confidence minimum edge confidence along that path
 */
public record ImpactEntry(String nodeId, int distance, double confidence) {}
