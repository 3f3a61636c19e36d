package io.controlplane.reconcile;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one global reconciliation pass.
 */
@Getter
@ToString
@AllArgsConstructor
public class GlobalReconcileResult {
    private final long desired;
    private final long total;
    private final long observed;
    private final int created;
    private final int deleted;
    /** The lease this pass ran under had expired by its end; any remaining gap is left to the next holder. */
    private final boolean leaseExpired;

    public boolean isStable() {
        return created == 0 && deleted == 0;
    }
}
