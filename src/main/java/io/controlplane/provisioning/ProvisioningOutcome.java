package io.controlplane.provisioning;

/**
 * How a provisioning request was resolved against the ledger.
 */
public enum ProvisioningOutcome {
    /**
     * This request created (or retried) the record and completed the work.
     */
    CREATED,

    /**
     * The record was already PROVISIONED; nothing was done.
     */
    ALREADY_PROVISIONED,

    /**
     * The record is PROVISIONING under another request or awaiting shard reconciliation.
     */
    IN_PROGRESS
}
