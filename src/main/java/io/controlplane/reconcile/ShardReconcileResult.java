package io.controlplane.reconcile;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Shard-local tally of one shard reconciliation pass. A partial view of the cluster, used
 * for logging only.
 */
@Getter
@ToString
@AllArgsConstructor
public class ShardReconcileResult {
    private final int owned;
    private final int completed;
    private final long shardObserved;
}
