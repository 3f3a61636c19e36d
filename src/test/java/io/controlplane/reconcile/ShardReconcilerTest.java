package io.controlplane.reconcile;

import io.controlplane.enums.ProvisioningState;
import io.controlplane.models.ClusterState;
import io.controlplane.models.ResourceRecord;
import io.controlplane.sharding.ShardConfig;
import io.controlplane.sharding.ShardRouter;
import io.controlplane.store.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShardReconcilerTest {

    @Mock
    private LedgerStore store;

    private ClusterState clusterState;

    @BeforeEach
    void setUp() {
        clusterState = new ClusterState(0, 7);
    }

    @Test
    void testReconcile_CompletesOnlyOwnedProvisioningRecords() {
        // Given
        ShardConfig shard = new ShardConfig(1, 3);
        List<ResourceRecord> records = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            records.add(record("resource-" + i, ProvisioningState.PROVISIONING));
        }
        when(store.findAllResources()).thenReturn(records);
        when(store.transitionResource(anyString(), eq(ProvisioningState.PROVISIONING), eq(ProvisioningState.PROVISIONED)))
            .thenReturn(true);
        int owned = (int) records.stream().filter(r -> ShardRouter.ownsShard(r.getId(), 1, 3)).count();

        // When
        ShardReconcileResult result = new ShardReconciler(store, shard, clusterState).reconcile("n2");

        // Then
        assertThat(result.getOwned()).isEqualTo(owned);
        assertThat(result.getCompleted()).isEqualTo(owned);
        for (ResourceRecord record : records) {
            if (ShardRouter.ownsShard(record.getId(), 1, 3)) {
                verify(store).transitionResource(record.getId(), ProvisioningState.PROVISIONING, ProvisioningState.PROVISIONED);
            } else {
                verify(store, never()).transitionResource(eq(record.getId()), any(), any());
            }
        }
    }

    @Test
    void testReconcile_NeverWritesObserved() {
        // Given
        when(store.findAllResources()).thenReturn(List.of(
            record("a", ProvisioningState.PROVISIONED),
            record("b", ProvisioningState.PROVISIONING)));
        when(store.transitionResource(anyString(), any(), any())).thenReturn(true);

        // When
        ShardReconcileResult result = new ShardReconciler(store, ShardConfig.singleNode(), clusterState).reconcile("n1");

        // Then - shard tally is local only
        assertThat(result.getShardObserved()).isEqualTo(2);
        assertThat(clusterState.getObserved()).isEqualTo(7);
    }

    @Test
    void testReconcile_ContinuesAfterPerRecordFailure() {
        // Given
        when(store.findAllResources()).thenReturn(List.of(
            record("broken", ProvisioningState.PROVISIONING),
            record("fine", ProvisioningState.PROVISIONING)));
        when(store.transitionResource(eq("broken"), any(), any()))
            .thenThrow(new DataAccessResourceFailureException("lock timeout"));
        when(store.transitionResource(eq("fine"), any(), any())).thenReturn(true);

        // When
        ShardReconcileResult result = new ShardReconciler(store, ShardConfig.singleNode(), clusterState).reconcile("n1");

        // Then
        assertThat(result.getOwned()).isEqualTo(2);
        assertThat(result.getCompleted()).isEqualTo(1);
    }

    @Test
    void testReconcile_LeavesFailedRecordsAlone() {
        when(store.findAllResources()).thenReturn(List.of(record("f", ProvisioningState.FAILED)));

        ShardReconcileResult result = new ShardReconciler(store, ShardConfig.singleNode(), clusterState).reconcile("n1");

        assertThat(result.getCompleted()).isZero();
        verify(store, never()).transitionResource(anyString(), any(), any());
    }

    private static ResourceRecord record(String id, ProvisioningState state) {
        return ResourceRecord.builder().id(id).state(state).build();
    }
}
