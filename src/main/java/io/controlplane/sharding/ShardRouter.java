package io.controlplane.sharding;

import java.nio.charset.StandardCharsets;

/**
 * Maps a resource id to the node that owns it.
 *
 * Every node computes the same answer independently:
 * - Deterministic: same id and node count always give the same owner
 * - Exhaustive and disjoint: for a fixed node count exactly one index owns an id
 * - Uniform: FNV-1a spreads ids evenly across indexes
 *
 * The store has no knowledge of this function, so callers load records first and filter
 * in memory.
 */
public final class ShardRouter {

    private static final int FNV_32_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_32_PRIME = 0x01000193;

    private ShardRouter() {
    }

    /**
     * @param resourceId the shard key
     * @param nodeIndex  candidate owner, 0-based
     * @param totalNodes number of nodes in the cluster, at least 1
     * @return true iff {@code hash(resourceId) mod totalNodes == nodeIndex}
     */
    public static boolean ownsShard(String resourceId, int nodeIndex, int totalNodes) {
        return ownerOf(resourceId, totalNodes) == nodeIndex;
    }

    /**
     * @return the index in {@code [0, totalNodes)} that owns the resource
     */
    public static int ownerOf(String resourceId, int totalNodes) {
        if (totalNodes <= 0) {
            throw new IllegalArgumentException("totalNodes must be positive, got " + totalNodes);
        }
        long unsignedHash = Integer.toUnsignedLong(hash(resourceId));
        return (int) (unsignedHash % totalNodes);
    }

    /**
     * 32-bit FNV-1a over the UTF-8 bytes of the id.
     */
    static int hash(String resourceId) {
        int hash = FNV_32_OFFSET_BASIS;
        for (byte b : resourceId.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_32_PRIME;
        }
        return hash;
    }
}
