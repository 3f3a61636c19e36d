package io.controlplane.election;

import io.controlplane.models.LeaseRecord;
import io.controlplane.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static io.controlplane.config.Constants.LEASE_ID;

/**
 * Handles leader election for the control plane through a single lease row.
 * <p>
 * Leadership is claimed with one atomic conditional update that succeeds only when this node
 * already holds the lease (heartbeat) or the current holder's lease expired (takeover). It is
 * never read-then-written. A crashed leader is replaced once its {@code expires_at} passes, so
 * failover latency is bounded by the lease duration.
 */
@Slf4j
public class LeaseManager {

    private final LedgerStore store;
    private final Duration leaseDuration;
    private final Clock clock;
    private final AtomicBoolean isLeader = new AtomicBoolean(false);
    private final AtomicReference<Instant> leaseDeadline = new AtomicReference<>(Instant.EPOCH);

    /**
     * @param store         the shared ledger store holding the lease row
     * @param leaseDuration how long a successful acquisition is valid; callers must heartbeat
     *                      strictly more often than this
     * @param clock         source of "now" for expiry checks
     */
    public LeaseManager(LedgerStore store, Duration leaseDuration, Clock clock) {
        this.store = store;
        this.leaseDuration = leaseDuration;
        this.clock = clock;
    }

    /**
     * Try to acquire or renew the reconciler lease for {@code nodeId}.
     * Store errors are logged and reported as "not leader this tick".
     *
     * @return true if this node is the leader until now + lease duration
     */
    public boolean tryAcquireLease(String nodeId) {
        Instant now = Instant.now(clock);
        Instant expiresAt = now.plus(leaseDuration);
        boolean wasLeader = isLeader.get();

        try {
            // 1. Heartbeat or takeover in a single atomic UPDATE
            if (store.renewOrTakeOverLease(LEASE_ID, nodeId, now, expiresAt)) {
                if (wasLeader) {
                    log.debug("[Node: {}][Lease] Renewed lease until {}", nodeId, expiresAt);
                } else {
                    log.info("[Node: {}][Lease] Acquired lease, now LEADER until {}", nodeId, expiresAt);
                }
                leaseDeadline.set(expiresAt);
                isLeader.set(true);
                return true;
            }

            // 2. No row updated: the lease row may not exist yet (first boot)
            Optional<LeaseRecord> current = store.findLease(LEASE_ID);
            if (current.isEmpty()) {
                return tryCreateLease(nodeId, expiresAt, wasLeader);
            }

            LeaseRecord holder = current.get();
            if (holder.isExpiredAt(now)) {
                // Row changed between the update and the read
                log.info("[Node: {}][Lease] Lease of node {} expired but takeover did not apply, retrying next tick",
                    nodeId, holder.getNodeId());
            } else {
                log.debug("[Node: {}][Lease] Held by node: {} (active for {}s more)",
                    nodeId, holder.getNodeId(), Duration.between(now, holder.getExpiresAt()).toSeconds());
            }
            stepDown(nodeId, wasLeader);
            return false;

        } catch (DataAccessException e) {
            log.error("[Node: {}][Lease] Store error during lease attempt: {}", nodeId, e.getMessage());
            stepDown(nodeId, wasLeader);
            return false;
        }
    }

    private boolean tryCreateLease(String nodeId, Instant expiresAt, boolean wasLeader) {
        try {
            store.insertLease(LeaseRecord.builder()
                .id(LEASE_ID)
                .nodeId(nodeId)
                .expiresAt(expiresAt)
                .build());
            log.info("[Node: {}][Lease] Created lease row, now LEADER until {}", nodeId, expiresAt);
            leaseDeadline.set(expiresAt);
            isLeader.set(true);
            return true;
        } catch (DuplicateKeyException e) {
            log.info("[Node: {}][Lease] Another node created the lease first, following", nodeId);
            stepDown(nodeId, wasLeader);
            return false;
        }
    }

    private void stepDown(String nodeId, boolean wasLeader) {
        if (wasLeader) {
            log.warn("[Node: {}][Lease] Lost leadership", nodeId);
        }
        leaseDeadline.set(Instant.EPOCH);
        isLeader.set(false);
    }

    /**
     * @return the outcome of the most recent acquisition attempt on this node
     */
    public boolean isLeader() {
        return isLeader.get();
    }

    /**
     * Expiry of the lease this node holds, or {@link Instant#EPOCH} when it is not the leader.
     * Leader-only work must stop once this instant passes: another node may take over then.
     */
    public Instant getLeaseDeadline() {
        return leaseDeadline.get();
    }

    /**
     * Current lease holder as stored, for reporting only.
     */
    public Optional<LeaseRecord> currentHolder() {
        try {
            return store.findLease(LEASE_ID);
        } catch (DataAccessException e) {
            log.warn("[Lease] Failed to read lease holder: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
