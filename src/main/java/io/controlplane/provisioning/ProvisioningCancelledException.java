package io.controlplane.provisioning;

/**
 * Thrown when provisioning work is abandoned before it completes, because the deadline
 * passed or the waiting thread was interrupted. The ledger record stays PROVISIONING.
 */
public class ProvisioningCancelledException extends Exception {

    private final String resourceId;

    public ProvisioningCancelledException(String resourceId, String message) {
        super(message);
        this.resourceId = resourceId;
    }

    public ProvisioningCancelledException(String resourceId, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
