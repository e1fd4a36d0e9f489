package io.devguard.engine;

/**
 * Thrown when an analysis or simulation observes its cancellation token.
 * Partial results are discarded.
 */
public class AnalysisCancelledException extends RuntimeException {

    public AnalysisCancelledException() {
        super("Analysis cancelled");
    }
}
