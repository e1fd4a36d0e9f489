package io.devguard.engine;

import java.util.List;

/**
 * A malformed ingestion batch. Nothing is published and the previous snapshot stays current.
 */
public class ValidationException extends Exception {

    private final List<String> problems;

    public ValidationException(List<String> problems) {
        super(problems.size() == 1
                ? "Invalid ingestion batch: " + problems.get(0)
                : "Invalid ingestion batch (" + problems.size() + " problems): " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
