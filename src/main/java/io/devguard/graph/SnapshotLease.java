package io.devguard.graph;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A reader's hold on one snapshot. Closing the lease releases the reference;
 * closing twice is a no-op.
 */
public final class SnapshotLease implements AutoCloseable {

    private final Snapshot snapshot;
    private final AtomicBoolean closed = new AtomicBoolean();

    SnapshotLease(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public DependencyGraph graph() {
        return snapshot.graph();
    }

    public long version() {
        return snapshot.version();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            snapshot.release();
        }
    }
}
