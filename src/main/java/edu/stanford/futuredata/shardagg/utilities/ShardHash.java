package edu.stanford.futuredata.shardagg.utilities;

import edu.stanford.futuredata.shardagg.shard.GroupKey;

/**
 * Deterministic assignment of group keys to shards.  Pure functions only: the same key maps to the same shard on
 * every worker and every run with the same shard count.
 */
public final class ShardHash {

    private static final double A = (Math.sqrt(5) - 1) / 2;
    private static final int m = 2147483647; // 2 ^ 31 - 1

    private ShardHash() {}

    public static int hashFunction(int k) {
        // from CLRS, including the magic numbers.
        return (int) (m * (k * A - Math.floor(k * A)));
    }

    public static int shardIndexOf(GroupKey key, int shardCount) {
        return hashFunction(key.hashCode()) % shardCount;
    }

    // Slot hash for open addressing inside one shard table.  Independent of the shard bits.
    public static int slotHash(int k) {
        int h = k;
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
