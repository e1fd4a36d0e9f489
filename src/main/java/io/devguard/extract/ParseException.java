package io.devguard.extract;

/**
 * Raised by a language adapter when a document is not syntactically valid.
 * Converted into an {@link io.devguard.model.UnparsedFile} by the registry.
 */
public class ParseException extends Exception {

    private final int line;

    public ParseException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
