package io.devguard.graph;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongConsumer;

/**
 * A published, versioned graph.
 * <p>
 * The graph itself is immutable. The reference count only tracks lifetime: the store
 * holds one reference while the snapshot is current, and every open
 * {@link SnapshotLease} holds another. A snapshot whose count reaches zero is retired
 * and can never be retained again.
 */
public final class Snapshot {

    private final long version;
    private final DependencyGraph graph;
    private final Instant publishedAt;
    private final AtomicInteger references = new AtomicInteger(1);
    private final LongConsumer onRetire;

    Snapshot(long version, DependencyGraph graph, Instant publishedAt, LongConsumer onRetire) {
        this.version = version;
        this.graph = graph;
        this.publishedAt = publishedAt;
        this.onRetire = onRetire;
    }

    public long version() {
        return version;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public Instant publishedAt() {
        return publishedAt;
    }

    public boolean isRetired() {
        return references.get() == 0;
    }

    int referenceCount() {
        return references.get();
    }

    /**
     * Adds a reference unless the snapshot has already been retired.
     */
    boolean tryRetain() {
        while (true) {
            int current = references.get();
            if (current == 0) {
                return false;
            }
            if (references.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void release() {
        int remaining = references.decrementAndGet();
        if (remaining == 0) {
            onRetire.accept(version);
        } else if (remaining < 0) {
            throw new IllegalStateException("Snapshot " + version + " released more often than retained");
        }
    }

    @Override
    public String toString() {
        return "Snapshot{version=" + version + ", nodes=" + graph.nodeCount() + ", edges=" + graph.edgeCount() + "}";
    }
}
