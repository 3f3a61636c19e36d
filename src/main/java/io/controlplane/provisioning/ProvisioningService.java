package io.controlplane.provisioning;

import io.controlplane.enums.ProvisioningState;
import io.controlplane.metrics.MetricsProvider;
import io.controlplane.models.ClusterState;
import io.controlplane.models.ResourceRecord;
import io.controlplane.stats.StatsAggregator;
import io.controlplane.stats.StatsEvent;
import io.controlplane.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;

import java.time.Duration;
import java.util.Optional;

/**
 * Entity-level idempotency for provisioning: every request is resolved against the resource
 * ledger by resource id, so two requests for the same id never run the work twice no matter
 * which idempotency keys they carry.
 * <p>
 * Store failures propagate as {@link org.springframework.dao.DataAccessException}.
 */
@Slf4j
public class ProvisioningService {

    private final LedgerStore store;
    private final SimulatedProvisioner provisioner;
    private final ClusterState clusterState;
    private final MetricsProvider metricsProvider;
    private final StatsAggregator statsAggregator;

    public ProvisioningService(LedgerStore store,
                               SimulatedProvisioner provisioner,
                               ClusterState clusterState,
                               MetricsProvider metricsProvider,
                               StatsAggregator statsAggregator) {
        this.store = store;
        this.provisioner = provisioner;
        this.clusterState = clusterState;
        this.metricsProvider = metricsProvider;
        this.statsAggregator = statsAggregator;
    }

    /**
     * Provision {@code resourceId}, waiting at most {@code deadline} for the work.
     *
     * @throws ProvisioningCancelledException if the wait was abandoned; the record is left
     *                                        PROVISIONING for the shard reconciler
     */
    public ProvisioningResult provision(String resourceId, Duration deadline) throws ProvisioningCancelledException {
        Optional<ResourceRecord> existing = store.findResource(resourceId);

        if (existing.isPresent()) {
            Optional<ProvisioningResult> resolved = resolveExisting(existing.get());
            if (resolved.isPresent()) {
                return record(resolved.get());
            }
            // FAILED record flipped back to PROVISIONING: this request retries the work
        } else if (!createRecord(resourceId)) {
            // Lost the insert race to a concurrent request for the same id
            ResourceRecord winner = store.findResource(resourceId)
                .orElseThrow(() -> new IllegalStateException("Resource " + resourceId + " vanished after duplicate insert"));
            Optional<ProvisioningResult> resolved = resolveExisting(winner);
            if (resolved.isPresent()) {
                return record(resolved.get());
            }
        }

        try {
            provisioner.provision(resourceId, deadline);
        } catch (ProvisioningCancelledException e) {
            log.warn("[Provision] Work for {} abandoned ({}); record stays PROVISIONING", resourceId, e.getMessage());
            metricsProvider.recordProvisionCancelled();
            statsAggregator.record(StatsEvent.of(StatsEvent.Type.PROVISION_CANCELLED));
            throw e;
        }

        if (!store.transitionResource(resourceId, ProvisioningState.PROVISIONING, ProvisioningState.PROVISIONED)) {
            log.info("[Provision] Resource {} was no longer PROVISIONING at completion", resourceId);
        }
        ResourceRecord completed = store.findResource(resourceId).orElseGet(() -> ResourceRecord.builder()
            .id(resourceId)
            .state(ProvisioningState.PROVISIONED)
            .build());
        log.info("[Provision] Resource provisioning completed for {}", resourceId);
        return record(new ProvisioningResult(ProvisioningOutcome.CREATED, completed));
    }

    /**
     * @return the final answer for a record that needs no work, or empty if a FAILED record
     *         was claimed for a retry
     */
    private Optional<ProvisioningResult> resolveExisting(ResourceRecord record) {
        log.info("[Provision] Resource found for {}, current state: {}", record.getId(), record.getState());
        switch (record.getState()) {
            case PROVISIONED:
                return Optional.of(new ProvisioningResult(ProvisioningOutcome.ALREADY_PROVISIONED, record));
            case FAILED:
                if (store.transitionResource(record.getId(), ProvisioningState.FAILED, ProvisioningState.PROVISIONING)) {
                    log.info("[Provision] Retrying failed resource {}", record.getId());
                    return Optional.empty();
                }
                // Someone else claimed the retry
                return Optional.of(new ProvisioningResult(ProvisioningOutcome.IN_PROGRESS, record));
            case PROVISIONING:
            default:
                return Optional.of(new ProvisioningResult(ProvisioningOutcome.IN_PROGRESS, record));
        }
    }

    private boolean createRecord(String resourceId) {
        try {
            store.insertResource(ResourceRecord.builder()
                .id(resourceId)
                .state(ProvisioningState.PROVISIONING)
                .build());
        } catch (DuplicateKeyException e) {
            log.info("[Provision] Concurrent request created {} first", resourceId);
            return false;
        }
        long desired = clusterState.incrementDesired();
        log.info("[Provision] Created ledger record for {} (desired now {})", resourceId, desired);
        return true;
    }

    private ProvisioningResult record(ProvisioningResult result) {
        metricsProvider.recordProvisionOutcome(result.getOutcome());
        switch (result.getOutcome()) {
            case CREATED:
                statsAggregator.record(StatsEvent.of(StatsEvent.Type.PROVISION_CREATED));
                break;
            case ALREADY_PROVISIONED:
                statsAggregator.record(StatsEvent.of(StatsEvent.Type.PROVISION_ALREADY_PROVISIONED));
                break;
            default:
                statsAggregator.record(StatsEvent.of(StatsEvent.Type.PROVISION_IN_PROGRESS));
        }
        return result;
    }
}
