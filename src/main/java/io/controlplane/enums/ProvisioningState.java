package io.controlplane.enums;

/**
 * Lifecycle of a resource in the ledger.
 *
 * <ul>
 *   <li><strong>PROVISIONING</strong> - Record exists, provisioning work not yet completed</li>
 *   <li><strong>PROVISIONED</strong> - Provisioning work completed</li>
 *   <li><strong>FAILED</strong> - Provisioning failed; a new request retries it</li>
 * </ul>
 */
public enum ProvisioningState {
    /**
     * Record exists, provisioning work is in flight or was interrupted.
     */
    PROVISIONING,

    /**
     * Provisioning work completed.
     */
    PROVISIONED,

    /**
     * Provisioning failed.
     */
    FAILED
}
