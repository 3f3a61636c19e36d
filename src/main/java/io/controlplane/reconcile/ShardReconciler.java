package io.controlplane.reconcile;

import io.controlplane.enums.ProvisioningState;
import io.controlplane.models.ClusterState;
import io.controlplane.models.ResourceRecord;
import io.controlplane.sharding.ShardConfig;
import io.controlplane.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.List;

/**
 * Completes interrupted provisioning work for the resources this node's shard owns.
 * Runs on every node on every tick regardless of leadership; the shard split keeps two
 * nodes from working on the same record.
 * <p>
 * Never writes the cluster-wide observed counter: a shard tally is a partial view.
 */
@Slf4j
public class ShardReconciler {

    private final LedgerStore store;
    private final ShardConfig shardConfig;
    private final ClusterState clusterState;

    public ShardReconciler(LedgerStore store, ShardConfig shardConfig, ClusterState clusterState) {
        this.store = store;
        this.shardConfig = shardConfig;
        this.clusterState = clusterState;
    }

    public ShardReconcileResult reconcile(String nodeId) {
        // The store does not know the hash function: load everything, filter in memory
        List<ResourceRecord> all = store.findAllResources();

        int owned = 0;
        int completed = 0;
        long shardObserved = 0;
        for (ResourceRecord record : all) {
            if (!shardConfig.ownsShard(record.getId())) {
                continue;
            }
            owned++;

            if (record.getState() == ProvisioningState.PROVISIONED) {
                shardObserved++;
            } else if (record.getState() == ProvisioningState.PROVISIONING) {
                if (complete(nodeId, record)) {
                    completed++;
                    shardObserved++;
                }
            }
        }

        log.info("[Node: {}][Shard {}/{}] owned={} completed={} shard observed={} (cluster observed={})",
            nodeId, shardConfig.getNodeIndex(), shardConfig.getTotalNodes(),
            owned, completed, shardObserved, clusterState.getObserved());
        return new ShardReconcileResult(owned, completed, shardObserved);
    }

    private boolean complete(String nodeId, ResourceRecord record) {
        try {
            boolean updated = store.transitionResource(
                record.getId(), ProvisioningState.PROVISIONING, ProvisioningState.PROVISIONED);
            if (updated) {
                log.info("[Node: {}][Shard {}/{}] Completed resource: {}",
                    nodeId, shardConfig.getNodeIndex(), shardConfig.getTotalNodes(), record.getId());
            }
            return updated;
        } catch (DataAccessException e) {
            log.error("[Node: {}][Shard {}/{}] Failed to complete resource {}: {}",
                nodeId, shardConfig.getNodeIndex(), shardConfig.getTotalNodes(), record.getId(), e.getMessage());
            return false;
        }
    }
}
