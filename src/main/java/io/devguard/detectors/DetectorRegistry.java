package io.devguard.detectors;

import java.util.*;

/**
 * Registry of all available detectors.
 */
public class DetectorRegistry {

    private final List<Detector> detectors;

    private DetectorRegistry(List<Detector> detectors) {
        Set<String> ids = new HashSet<>();
        for (Detector detector : detectors) {
            if (!ids.add(detector.id())) {
                throw new IllegalArgumentException("Duplicate detector id: " + detector.id());
            }
        }
        this.detectors = List.copyOf(detectors);
    }

    /**
     * Creates a registry with all default detectors.
     */
    public static DetectorRegistry createDefault() {
        return new DetectorRegistry(List.of(
                new CycleDetector(),
                new GodObjectDetector(),
                new OrphanDetector(),
                new ProductionRiskDetector()
        ));
    }

    /**
     * Creates a registry with specific detectors.
     */
    public static DetectorRegistry of(Detector... detectors) {
        return new DetectorRegistry(Arrays.asList(detectors));
    }

    /**
     * Returns the detectors that run when the given ids are switched off.
     *
     * @throws IllegalArgumentException if an id names no registered detector
     */
    public List<Detector> enabledDetectors(Set<String> disabled) {
        for (String id : disabled) {
            if (getById(id).isEmpty()) {
                throw new IllegalArgumentException("detectors.disabled names an unknown detector: " + id);
            }
        }
        return detectors.stream()
                .filter(d -> !disabled.contains(d.id()))
                .toList();
    }

    /**
     * Returns all registered detectors.
     */
    public List<Detector> allDetectors() {
        return detectors;
    }

    /**
     * Returns a detector by ID, if present.
     */
    public Optional<Detector> getById(String id) {
        return detectors.stream()
                .filter(d -> d.id().equals(id))
                .findFirst();
    }
}
