package io.devguard.model;

/**
 * A document that contributed nothing to the graph.
 *
 * @param path     normalized path
 * @param language language tag the document was submitted with
 * @param reason   failure category
 * @param detail   human-readable explanation, e.g. the syntax error location
 */
public record UnparsedFile(String path, Language language, Reason reason, String detail) {

    public enum Reason {
        SYNTAX_ERROR,
        UNSUPPORTED_EXTENSION,
        UNSUPPORTED_LANGUAGE,
        EMPTY_FILE
    }

    public UnparsedFile {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (language == null) {
            language = Language.UNKNOWN;
        }
        if (detail == null) {
            detail = "";
        }
    }
}
