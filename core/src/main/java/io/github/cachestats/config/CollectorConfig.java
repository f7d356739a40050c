package io.github.cachestats.config;

import java.time.Duration;

/**
 * Staleness policy of the statistics collectors.
 *
 * <p>A request with maximum age {@code A} is served from the saved snapshot
 * while the snapshot is younger than
 * {@code min(A, max(minimumRescanInterval, rescanOverheadFactor * lastScanDuration))}.
 * With the defaults a scan therefore takes at most about 1% of the time and
 * runs at most once per second.</p>
 *
 * @param defaultMaximumAge maximum age used when a caller gives none
 * @param minimumRescanInterval snapshots younger than this are always reused
 * @param rescanOverheadFactor multiple of the last scan's duration below which a snapshot is reused
 */
public record CollectorConfig(
    Duration defaultMaximumAge,
    Duration minimumRescanInterval,
    int rescanOverheadFactor
) {

    public static final Duration DEFAULT_MAXIMUM_AGE = Duration.ofSeconds(180);
    public static final Duration DEFAULT_MINIMUM_RESCAN_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_RESCAN_OVERHEAD_FACTOR = 100;

    public CollectorConfig {
        if (defaultMaximumAge == null) {
            defaultMaximumAge = DEFAULT_MAXIMUM_AGE;
        }
        if (minimumRescanInterval == null) {
            minimumRescanInterval = DEFAULT_MINIMUM_RESCAN_INTERVAL;
        }
        if (defaultMaximumAge.isNegative()) {
            throw new IllegalArgumentException("defaultMaximumAge must not be negative: " + defaultMaximumAge);
        }
        if (minimumRescanInterval.isNegative()) {
            throw new IllegalArgumentException("minimumRescanInterval must not be negative: " + minimumRescanInterval);
        }
        if (rescanOverheadFactor < 0) {
            throw new IllegalArgumentException("rescanOverheadFactor must not be negative: " + rescanOverheadFactor);
        }
    }

    public static CollectorConfig defaults() {
        return new CollectorConfig(DEFAULT_MAXIMUM_AGE, DEFAULT_MINIMUM_RESCAN_INTERVAL, DEFAULT_RESCAN_OVERHEAD_FACTOR);
    }
}
