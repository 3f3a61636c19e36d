package io.controlplane.reconcile;

import io.controlplane.enums.ProvisioningState;
import io.controlplane.models.ClusterState;
import io.controlplane.models.ResourceRecord;
import io.controlplane.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static io.controlplane.config.Constants.GENERATED_RESOURCE_PREFIX;

/**
 * Cluster-wide scaling decisions, run only by the lease holder.
 * <p>
 * Level-triggered: every pass re-reads the store and closes the gap between the cached
 * desired count and the total number of ledger records. It is the only writer of
 * {@link ClusterState#setObserved(long)}. A store error aborts the pass; statements already
 * committed stay committed and the next tick starts from scratch.
 * <p>
 * A pass never outlives the lease it runs under: once the lease deadline passes it stops
 * writing and leaves the remaining gap to whichever node holds the lease next.
 */
@Slf4j
public class GlobalReconciler {

    private final LedgerStore store;
    private final ClusterState clusterState;
    private final Clock clock;

    public GlobalReconciler(LedgerStore store, ClusterState clusterState, Clock clock) {
        this.store = store;
        this.clusterState = clusterState;
        this.clock = clock;
    }

    /**
     * @param nodeId        the leader running the pass
     * @param leaseDeadline expiry of the lease held by {@code nodeId}; no write is issued at or after it
     */
    public GlobalReconcileResult reconcile(String nodeId, Instant leaseDeadline) {
        long total = store.countResources();
        long provisioned = store.countResourcesByState(ProvisioningState.PROVISIONED);

        clusterState.setObserved(provisioned);
        long desired = clusterState.getDesired();

        log.info("[Node: {}][Leader] Global state: desired={} total={} observed={}",
            nodeId, desired, total, provisioned);

        int created = 0;
        int deleted = 0;
        if (desired > total) {
            created = scaleUp(nodeId, desired - total, leaseDeadline);
        } else if (desired < total) {
            deleted = scaleDown(nodeId, total - desired, leaseDeadline);
        }
        boolean leaseExpired = leaseExpired(leaseDeadline);
        if (leaseExpired) {
            log.warn("[Node: {}][Leader] Lease deadline {} passed, stopped after created={} deleted={}",
                nodeId, leaseDeadline, created, deleted);
        }
        return new GlobalReconcileResult(desired, total, provisioned, created, deleted, leaseExpired);
    }

    private boolean leaseExpired(Instant leaseDeadline) {
        return !Instant.now(clock).isBefore(leaseDeadline);
    }

    private int scaleUp(String nodeId, long deficit, Instant leaseDeadline) {
        log.info("[Node: {}][Leader] Scale up: creating {} resource stubs", nodeId, deficit);
        int created = 0;
        for (long i = 0; i < deficit && !leaseExpired(leaseDeadline); i++) {
            String id = GENERATED_RESOURCE_PREFIX + UUID.randomUUID();
            try {
                store.insertResource(ResourceRecord.builder()
                    .id(id)
                    .state(ProvisioningState.PROVISIONING)
                    .build());
                created++;
            } catch (DuplicateKeyException e) {
                log.warn("[Node: {}][Leader] Generated id {} already exists, skipping", nodeId, id);
            }
        }
        return created;
    }

    private int scaleDown(String nodeId, long surplus, Instant leaseDeadline) {
        // Only PROVISIONED records are candidates; PROVISIONING ones are in-flight work
        int limit = (int) Math.min(surplus, Integer.MAX_VALUE);
        List<ResourceRecord> candidates = store.findResourcesByState(ProvisioningState.PROVISIONED, limit);
        log.info("[Node: {}][Leader] Scale down: surplus={}, deleting {} provisioned resources",
            nodeId, surplus, candidates.size());

        int deleted = 0;
        for (ResourceRecord candidate : candidates) {
            if (leaseExpired(leaseDeadline)) {
                break;
            }
            if (store.deleteResource(candidate.getId(), ProvisioningState.PROVISIONED)) {
                deleted++;
            } else {
                log.debug("[Node: {}][Leader] Resource {} changed before deletion, skipping", nodeId, candidate.getId());
            }
        }
        return deleted;
    }
}
