package io.github.cachestats.config;

/**
 * Settings of a {@link io.github.cachestats.cache.LocalCache}.
 *
 * <p>Example JSON:</p>
 * <pre>{@code
 * "cache": {
 *   "capacity": 33554432,
 *   "numShardBits": 4,
 *   "strictCapacityLimit": false
 * }
 * }</pre>
 *
 * @param capacity total charge the cache admits
 * @param numShardBits log2 of the number of shards
 * @param strictCapacityLimit whether an insert fails when room cannot be made
 */
public record CacheConfig(
    long capacity,
    int numShardBits,
    boolean strictCapacityLimit
) {

    public static final long DEFAULT_CAPACITY = 32L * 1024 * 1024;
    public static final int DEFAULT_NUM_SHARD_BITS = 4;
    public static final int MAX_NUM_SHARD_BITS = 12;

    public CacheConfig {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        if (numShardBits < 0 || numShardBits > MAX_NUM_SHARD_BITS) {
            throw new IllegalArgumentException("numShardBits must be in [0, " + MAX_NUM_SHARD_BITS + "]: " + numShardBits);
        }
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_CAPACITY, DEFAULT_NUM_SHARD_BITS, false);
    }

    public static CacheConfig ofCapacity(long capacity) {
        return new CacheConfig(capacity, DEFAULT_NUM_SHARD_BITS, false);
    }
}
