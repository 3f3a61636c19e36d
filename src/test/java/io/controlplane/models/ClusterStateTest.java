package io.controlplane.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ClusterStateTest {

    @Test
    void testSnapshot_ReportsStability() {
        ClusterState state = new ClusterState(3, 1);
        assertThat(state.snapshot().isStable()).isFalse();

        state.setObserved(3);

        ClusterState.Snapshot snapshot = state.snapshot();
        assertThat(snapshot.getDesired()).isEqualTo(3);
        assertThat(snapshot.getObserved()).isEqualTo(3);
        assertThat(snapshot.isStable()).isTrue();
    }

    @Test
    void testIncrementDesired_ConcurrentWriters() throws Exception {
        // Given
        ClusterState state = new ClusterState(0, 0);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < 4; t++) {
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    state.incrementDesired();
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        assertThat(state.getDesired()).isEqualTo(4000);
    }
}
