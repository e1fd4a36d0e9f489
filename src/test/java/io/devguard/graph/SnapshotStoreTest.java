package io.devguard.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.devguard.TestGraphs.function;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new SnapshotStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void newStore_servesEmptyVersionZero() {
        try (SnapshotLease lease = store.acquire()) {
            assertThat(lease.version()).isZero();
            assertThat(lease.graph().nodes()).isEmpty();
            assertThat(lease.snapshot().publishedAt()).isEqualTo(NOW);
        }
        assertThat(store.currentVersion()).isZero();
        assertThat(store.liveVersions()).containsExactly(0L);
    }

    @Test
    void publish_incrementsVersionAndRetiresUnleasedPredecessor() {
        Snapshot first = store.publish(graphOfSize(1));
        Snapshot second = store.publish(graphOfSize(2));

        assertThat(first.version()).isEqualTo(1);
        assertThat(second.version()).isEqualTo(2);
        assertThat(first.isRetired()).isTrue();
        assertThat(second.isRetired()).isFalse();
        assertThat(store.liveVersions()).containsExactly(2L);
    }

    @Test
    void lease_keepsSnapshotAliveAcrossPublish() {
        store.publish(graphOfSize(1));
        SnapshotLease lease = store.acquire();

        store.publish(graphOfSize(2));

        assertThat(lease.version()).isEqualTo(1);
        assertThat(lease.graph().nodeCount()).isEqualTo(1);
        assertThat(lease.snapshot().isRetired()).isFalse();
        assertThat(store.liveVersions()).containsExactly(1L, 2L);

        lease.close();

        assertThat(lease.snapshot().isRetired()).isTrue();
        assertThat(store.liveVersions()).containsExactly(2L);
    }

    @Test
    void lease_closingTwiceReleasesOnce() {
        store.publish(graphOfSize(1));
        SnapshotLease first = store.acquire();
        SnapshotLease second = store.acquire();

        first.close();
        first.close();

        assertThat(first.snapshot().referenceCount()).isEqualTo(2);
        second.close();
        assertThat(second.snapshot().referenceCount()).isEqualTo(1);
    }

    @Test
    void retiredSnapshot_cannotBeRetainedOrReleasedAgain() {
        Snapshot first = store.publish(graphOfSize(1));
        store.publish(graphOfSize(2));

        assertThat(first.tryRetain()).isFalse();
        assertThatThrownBy(first::release).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void acquire_neverObservesTornSnapshotsUnderConcurrentPublish() throws Exception {
        int publishes = 200;
        List<DependencyGraph> graphs = new ArrayList<>();
        for (int size = 1; size <= publishes; size++) {
            graphs.add(graphOfSize(size));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean done = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(3);
        try {
            List<Future<Long>> readers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                readers.add(pool.submit(() -> {
                    started.countDown();
                    long reads = 0;
                    long lastVersion = 0;
                    do {
                        try (SnapshotLease lease = store.acquire()) {
                            assertThat(lease.graph().nodeCount()).isEqualTo((int) lease.version());
                            assertThat(lease.version()).isGreaterThanOrEqualTo(lastVersion);
                            assertThat(lease.snapshot().isRetired()).isFalse();
                            lastVersion = lease.version();
                        }
                        reads++;
                    } while (!done.get());
                    return reads;
                }));
            }
            started.await(5, TimeUnit.SECONDS);
            for (DependencyGraph graph : graphs) {
                store.publish(graph);
            }
            done.set(true);
            for (Future<Long> reader : readers) {
                assertThat(reader.get(10, TimeUnit.SECONDS)).isPositive();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.currentVersion()).isEqualTo(publishes);
        assertThat(store.liveVersions()).containsExactly((long) publishes);
    }

    private static DependencyGraph graphOfSize(int size) {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (int i = 0; i < size; i++) {
            builder.addNode(function("svc.f" + i));
        }
        return builder.build();
    }
}
