package io.devguard.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of running all integrity detectors over one snapshot.
 *
 * @param snapshotVersion     snapshot the detectors ran against
 * @param findings            ordered findings
 * @param coverage            fraction of input files that parsed, in [0,1]
 * @param unparsedFiles       files that contributed nothing to the graph
 * @param unresolvedCount     number of references dropped during resolution
 * @param analyzedAt          when the analysis started
 * @param duration            how long the detectors took
 */
public record IntegrityReport(
        long snapshotVersion,
        List<IntegrityFinding> findings,
        double coverage,
        List<UnparsedFile> unparsedFiles,
        int unresolvedCount,
        Instant analyzedAt,
        Duration duration
) {

    public IntegrityReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
        unparsedFiles = unparsedFiles == null ? List.of() : List.copyOf(unparsedFiles);
    }

    public Map<FindingKind, List<IntegrityFinding>> findingsByKind() {
        return findings.stream()
                .collect(Collectors.groupingBy(IntegrityFinding::kind));
    }

    public List<IntegrityFinding> findingsOf(FindingKind kind) {
        return findings.stream()
                .filter(f -> f.kind() == kind)
                .toList();
    }

    /**
     * Returns true if there are any findings at or above the given severity.
     */
    public boolean hasFindingsAtLeast(Severity minimum) {
        return findings.stream()
                .anyMatch(f -> f.severity().isAtLeast(minimum));
    }

    public long countBySeverity(Severity severity) {
        return findings.stream()
                .filter(f -> f.severity() == severity)
                .count();
    }

    public int totalFindings() {
        return findings.size();
    }
}
