package io.devguard.report;

import io.devguard.graph.DependencyGraph;
import io.devguard.model.ImpactResult;
import io.devguard.model.IntegrityReport;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Interface for report output formatters.
 * The graph is the snapshot the result was computed on; it is used to name nodes.
 */
public interface Reporter {

    /**
     * Returns the format name (e.g., "console", "json").
     */
    String format();

    void writeReport(IntegrityReport report, DependencyGraph graph, Writer writer) throws IOException;

    void writeImpact(ImpactResult result, DependencyGraph graph, Writer writer) throws IOException;

    default void writeReport(IntegrityReport report, DependencyGraph graph, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeReport(report, graph, writer);
        }
    }

    /**
     * Returns the integrity report as a string.
     */
    default String toString(IntegrityReport report, DependencyGraph graph) {
        try {
            StringWriter writer = new StringWriter();
            writeReport(report, graph, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to generate report", e);
        }
    }

    /**
     * Returns the impact result as a string.
     */
    default String toString(ImpactResult result, DependencyGraph graph) {
        try {
            StringWriter writer = new StringWriter();
            writeImpact(result, graph, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to generate impact report", e);
        }
    }
}
