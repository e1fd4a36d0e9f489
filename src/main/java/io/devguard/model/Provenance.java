package io.devguard.model;

/**
 * Where in the source a node or edge came from.
 *
 * @param path      normalized path of the originating file
 * @param startLine first line (1-based), or 0 when unknown
 * @param endLine   last line (inclusive)
 */
public record Provenance(String path, int startLine, int endLine) {

    public Provenance {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (startLine < 0) {
            startLine = 0;
        }
        if (endLine < startLine) {
            endLine = startLine;
        }
    }

    public static Provenance line(String path, int line) {
        return new Provenance(path, line, line);
    }

    /**
     * Returns a display-friendly location such as {@code app/views.py:12-14}.
     */
    public String location() {
        if (startLine <= 0) {
            return path;
        }
        if (endLine == startLine) {
            return path + ":" + startLine;
        }
        return path + ":" + startLine + "-" + endLine;
    }
}
