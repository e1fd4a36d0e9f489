package io.devguard.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current graph snapshot.
 * <p>
 * Readers never lock: {@link #acquire()} reads the current pointer and retains that
 * snapshot, retrying if a concurrent publish retired it in between. Publishing is an
 * atomic pointer swap followed by releasing the store's reference to the previous
 * snapshot, which stays alive until its last lease closes. Versions increase by one
 * per publish, starting from an empty snapshot at version 0.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final AtomicReference<Snapshot> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();
    private final Set<Long> live = new ConcurrentSkipListSet<>();
    private final Clock clock;

    public SnapshotStore() {
        this(Clock.systemUTC());
    }

    SnapshotStore(Clock clock) {
        this.clock = clock;
        current.set(newSnapshot(0L, DependencyGraph.empty()));
    }

    /**
     * Publishes a graph as the new current snapshot and returns it.
     */
    public Snapshot publish(DependencyGraph graph) {
        Snapshot next = newSnapshot(versions.incrementAndGet(), graph);
        Snapshot previous = current.getAndSet(next);
        log.info("Published snapshot v{} ({} nodes, {} edges)", next.version(), graph.nodeCount(), graph.edgeCount());
        if (previous != null) {
            previous.release();
        }
        return next;
    }

    /**
     * Retains the current snapshot. The caller must close the lease.
     */
    public SnapshotLease acquire() {
        while (true) {
            Snapshot snapshot = current.get();
            if (snapshot.tryRetain()) {
                return new SnapshotLease(snapshot);
            }
        }
    }

    /**
     * Version of the current snapshot.
     */
    public long currentVersion() {
        return current.get().version();
    }

    /**
     * Versions of snapshots that are current or still held by a lease, ascending.
     */
    public List<Long> liveVersions() {
        return List.copyOf(live);
    }

    private Snapshot newSnapshot(long version, DependencyGraph graph) {
        live.add(version);
        return new Snapshot(version, graph, clock.instant(), this::retire);
    }

    private void retire(long version) {
        live.remove(version);
        log.debug("Retired snapshot v{}", version);
    }
}
