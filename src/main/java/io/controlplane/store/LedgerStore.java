package io.controlplane.store;

import io.controlplane.enums.ProvisioningState;
import io.controlplane.models.IdempotencyRecord;
import io.controlplane.models.LeaseRecord;
import io.controlplane.models.ResourceRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Abstraction over the shared durable store all control plane nodes poll.
 * <p>
 * Implementations must be transactional per statement and enforce uniqueness of resource
 * ids, idempotency keys and the lease row. Failures surface as Spring
 * {@link org.springframework.dao.DataAccessException}s; a unique-constraint violation is a
 * {@link org.springframework.dao.DuplicateKeyException}.
 */
public interface LedgerStore {

    /**
     * Create the schema if absent.
     */
    void initialize();

    // =================================================================
    // RESOURCE LEDGER OPERATIONS
    // =================================================================

    Optional<ResourceRecord> findResource(String id);

    /**
     * Insert a new resource record.
     *
     * @throws org.springframework.dao.DuplicateKeyException if a record with the id exists
     */
    void insertResource(ResourceRecord record);

    /**
     * Move a record from one state to another, only if it is currently in {@code from}.
     *
     * @return true if the row was updated
     */
    boolean transitionResource(String id, ProvisioningState from, ProvisioningState to);

    /**
     * Delete a record, only if it is currently in {@code expected}.
     *
     * @return true if the row was deleted
     */
    boolean deleteResource(String id, ProvisioningState expected);

    List<ResourceRecord> findAllResources();

    List<ResourceRecord> findResourcesByState(ProvisioningState state, int limit);

    long countResources();

    long countResourcesByState(ProvisioningState state);

    // =================================================================
    // IDEMPOTENCY RECORD OPERATIONS
    // =================================================================

    Optional<IdempotencyRecord> findIdempotencyRecord(String key);

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the key was already recorded
     */
    void insertIdempotencyRecord(IdempotencyRecord record);

    // =================================================================
    // LEASE OPERATIONS
    // =================================================================

    /**
     * Atomically claim the lease for {@code nodeId} if it already holds it or the current
     * holder expired before {@code now}.
     *
     * @return true if the row was updated
     */
    boolean renewOrTakeOverLease(String leaseId, String nodeId, Instant now, Instant expiresAt);

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the lease row exists
     */
    void insertLease(LeaseRecord lease);

    Optional<LeaseRecord> findLease(String leaseId);
}
