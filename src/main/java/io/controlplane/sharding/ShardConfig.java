package io.controlplane.sharding;

import lombok.Getter;
import lombok.ToString;

/**
 * Sharding placement of this node: its 0-based index and the total node count.
 * Supplied externally; single-node mode (0 of 1) owns every resource.
 */
@Getter
@ToString
public class ShardConfig {

    private final int nodeIndex;
    private final int totalNodes;

    public ShardConfig(int nodeIndex, int totalNodes) {
        if (totalNodes <= 0) {
            throw new IllegalArgumentException("totalNodes must be positive, got " + totalNodes);
        }
        if (nodeIndex < 0 || nodeIndex >= totalNodes) {
            throw new IllegalArgumentException(
                "nodeIndex must be in [0, " + totalNodes + "), got " + nodeIndex);
        }
        this.nodeIndex = nodeIndex;
        this.totalNodes = totalNodes;
    }

    public static ShardConfig singleNode() {
        return new ShardConfig(0, 1);
    }

    /**
     * @return true if this node is responsible for the given resource
     */
    public boolean ownsShard(String resourceId) {
        return ShardRouter.ownsShard(resourceId, nodeIndex, totalNodes);
    }
}
