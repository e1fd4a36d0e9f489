package io.devguard.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between a caller and a running analysis.
 * Traversals and detectors check it between node visits.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Returns a fresh token that nobody else holds, for callers that never cancel.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws AnalysisCancelledException if {@link #cancel()} has been called
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new AnalysisCancelledException();
        }
    }
}
