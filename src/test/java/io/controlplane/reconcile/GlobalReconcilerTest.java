package io.controlplane.reconcile;

import io.controlplane.enums.ProvisioningState;
import io.controlplane.models.ClusterState;
import io.controlplane.models.ResourceRecord;
import io.controlplane.sharding.ShardConfig;
import io.controlplane.store.JdbcLedgerStore;
import io.controlplane.store.LedgerStore;
import io.controlplane.support.H2LedgerStores;
import io.controlplane.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class GlobalReconcilerTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant LEASE_DEADLINE = START.plusSeconds(15);

    private EmbeddedDatabase database;
    private MutableClock clock;
    private JdbcLedgerStore store;
    private ClusterState clusterState;
    private GlobalReconciler reconciler;

    @BeforeEach
    void setUp() {
        database = H2LedgerStores.newDatabase();
        clock = new MutableClock(START);
        store = H2LedgerStores.newStore(database, clock);
        clusterState = new ClusterState(0, 0);
        reconciler = new GlobalReconciler(store, clusterState, clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void testScaleUp_CreatesStubsThenShardPassCompletesThem() {
        // Given
        clusterState.setDesired(10);

        // When
        GlobalReconcileResult first = reconciler.reconcile("n1", LEASE_DEADLINE);

        // Then
        assertThat(first.getCreated()).isEqualTo(10);
        assertThat(store.countResources()).isEqualTo(10);
        assertThat(store.countResourcesByState(ProvisioningState.PROVISIONING)).isEqualTo(10);
        assertThat(store.findAllResources()).allSatisfy(r -> assertThat(r.getId()).startsWith("global-auto-"));
        assertThat(clusterState.getObserved()).isZero();

        // When - the single shard completes the work and the leader reconciles again
        new ShardReconciler(store, ShardConfig.singleNode(), clusterState).reconcile("n1");
        GlobalReconcileResult second = reconciler.reconcile("n1", LEASE_DEADLINE);

        // Then
        assertThat(second.isStable()).isTrue();
        assertThat(clusterState.getObserved()).isEqualTo(10);
        assertThat(clusterState.snapshot().isStable()).isTrue();
    }

    @Test
    void testScaleDown_DeletesOnlyProvisioned() {
        // Given
        for (int i = 0; i < 10; i++) {
            insert("p" + i, ProvisioningState.PROVISIONED);
        }
        clusterState.setDesired(2);

        // When
        GlobalReconcileResult result = reconciler.reconcile("n1", LEASE_DEADLINE);

        // Then
        assertThat(result.getDeleted()).isEqualTo(8);
        assertThat(store.countResources()).isEqualTo(2);
    }

    @Test
    void testScaleDown_NeverDeletesProvisioning() {
        // Given
        insert("busy-1", ProvisioningState.PROVISIONING);
        insert("busy-2", ProvisioningState.PROVISIONING);
        insert("done", ProvisioningState.PROVISIONED);
        clusterState.setDesired(0);

        // When
        GlobalReconcileResult result = reconciler.reconcile("n1", LEASE_DEADLINE);

        // Then
        assertThat(result.getDeleted()).isEqualTo(1);
        assertThat(store.findResource("busy-1")).isPresent();
        assertThat(store.findResource("busy-2")).isPresent();
        assertThat(store.findResource("done")).isEmpty();
    }

    @Test
    void testEqualCounts_NoAction() {
        insert("a", ProvisioningState.PROVISIONED);
        insert("b", ProvisioningState.PROVISIONING);
        clusterState.setDesired(2);

        GlobalReconcileResult result = reconciler.reconcile("n1", LEASE_DEADLINE);

        assertThat(result.getCreated()).isZero();
        assertThat(result.getDeleted()).isZero();
        assertThat(result.getTotal()).isEqualTo(2);
        assertThat(clusterState.getObserved()).isEqualTo(1);
    }

    @Test
    void testStoreError_LeavesObservedUnchanged() {
        // Given
        LedgerStore failing = mock(LedgerStore.class);
        when(failing.countResources()).thenThrow(new DataAccessResourceFailureException("down"));
        ClusterState state = new ClusterState(5, 3);
        GlobalReconciler failingReconciler = new GlobalReconciler(failing, state, clock);

        // When/Then
        assertThatThrownBy(() -> failingReconciler.reconcile("n1", LEASE_DEADLINE))
            .isInstanceOf(DataAccessResourceFailureException.class);
        assertThat(state.getObserved()).isEqualTo(3);
        verify(failing, never()).insertResource(any());
    }

    @Test
    void testScaleUp_StopsWhenLeaseExpires() {
        // Given - every insert takes two seconds of lease time
        LedgerStore slow = mock(LedgerStore.class);
        when(slow.countResources()).thenReturn(0L);
        when(slow.countResourcesByState(ProvisioningState.PROVISIONED)).thenReturn(0L);
        doAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(2));
            return null;
        }).when(slow).insertResource(any());
        clusterState.setDesired(1_000_000);
        GlobalReconciler slowReconciler = new GlobalReconciler(slow, clusterState, clock);

        // When
        GlobalReconcileResult result = slowReconciler.reconcile("n1", LEASE_DEADLINE);

        // Then - inserts at t=0,2,...,14; none at or after the 15s deadline
        assertThat(result.getCreated()).isEqualTo(8);
        assertThat(result.isLeaseExpired()).isTrue();
        verify(slow, times(8)).insertResource(any());
    }

    @Test
    void testScaleDown_StopsWhenLeaseExpires() {
        // Given
        for (int i = 0; i < 5; i++) {
            insert("p" + i, ProvisioningState.PROVISIONED);
        }
        clusterState.setDesired(0);
        clock.advance(Duration.ofSeconds(15));

        // When
        GlobalReconcileResult result = reconciler.reconcile("n1", LEASE_DEADLINE);

        // Then
        assertThat(result.getDeleted()).isZero();
        assertThat(result.isLeaseExpired()).isTrue();
        assertThat(store.countResources()).isEqualTo(5);
    }

    @Test
    void testScaleUp_SkipsGeneratedIdCollision() {
        // Given
        LedgerStore colliding = mock(LedgerStore.class);
        when(colliding.countResources()).thenReturn(0L);
        doThrow(new DuplicateKeyException("taken")).doNothing().when(colliding).insertResource(any());
        clusterState.setDesired(2);

        // When
        GlobalReconcileResult result = new GlobalReconciler(colliding, clusterState, clock).reconcile("n1", LEASE_DEADLINE);

        // Then
        assertThat(result.getCreated()).isEqualTo(1);
        assertThat(result.isLeaseExpired()).isFalse();
    }

    private void insert(String id, ProvisioningState state) {
        store.insertResource(ResourceRecord.builder().id(id).state(state).build());
    }
}
