package io.github.cachestats.config;

/**
 * Root configuration, as read by {@link ConfigLoader}.
 *
 * <pre>{@code
 * {
 *   "cache": { "capacity": 33554432, "numShardBits": 4, "strictCapacityLimit": false },
 *   "collector": {
 *     "defaultMaximumAgeSeconds": 180,
 *     "minimumRescanIntervalMillis": 1000,
 *     "rescanOverheadFactor": 100
 *   }
 * }
 * }</pre>
 */
public record CacheStatsConfig(
    CacheConfig cache,
    CollectorConfig collector
) {

    public CacheStatsConfig {
        if (cache == null) {
            cache = CacheConfig.defaults();
        }
        if (collector == null) {
            collector = CollectorConfig.defaults();
        }
    }

    public static CacheStatsConfig defaults() {
        return new CacheStatsConfig(CacheConfig.defaults(), CollectorConfig.defaults());
    }
}
