package io.devguard.engine;

import io.devguard.model.UnparsedFile;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one ingestion batch.
 *
 * @param snapshotVersion version of the snapshot the batch was published as
 * @param totalFiles      documents in the batch
 * @param parsedFiles     documents that contributed to the graph
 * @param unparsedFiles   documents that did not, with reasons
 * @param nodeCount       nodes in the published graph
 * @param edgeCount       edges in the published graph
 * @param unresolvedCount references dropped during resolution
 * @param duration        wall-clock time of extraction, merge and publish
 */
public record IngestionSummary(
        long snapshotVersion,
        int totalFiles,
        int parsedFiles,
        List<UnparsedFile> unparsedFiles,
        int nodeCount,
        int edgeCount,
        int unresolvedCount,
        Duration duration
) {

    public IngestionSummary {
        unparsedFiles = unparsedFiles == null ? List.of() : List.copyOf(unparsedFiles);
    }

    public double coverage() {
        return totalFiles == 0 ? 1.0 : (double) parsedFiles / totalFiles;
    }
}
