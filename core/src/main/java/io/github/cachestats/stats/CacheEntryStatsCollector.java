package io.github.cachestats.stats;

import io.github.cachestats.cache.ApplyToAllEntriesOptions;
import io.github.cachestats.cache.Cache;
import io.github.cachestats.cache.CacheInsertException;
import io.github.cachestats.cache.SharedCacheHandle;
import io.github.cachestats.clock.SystemClock;
import io.github.cachestats.config.CollectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gathers one kind of statistics by scanning every entry of a cache, and
 * shares the results among everyone asking for them.
 *
 * <p>Several partitions or clients sharing one cache would otherwise each scan
 * it. Instead:</p>
 * <ul>
 *   <li>Only one collector per stats kind lives in each cache. The cache
 *       itself holds it, as an entry under {@link StatsKind#key()}; see
 *       {@link StatsCollectorFactory}.</li>
 *   <li>A lock lets only one thread scan at a time.</li>
 *   <li>Recent results are saved and copied out to requests that tolerate
 *       their age.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (SharedCacheHandle<CacheEntryStatsCollector<CacheEntryRoleStats>> collector =
 *          CacheEntryStatsCollector.getShared(cache, SystemClock.getDefault(), CacheEntryRoleStats.KIND)) {
 *     CacheEntryRoleStats stats = collector.get().getStats(Duration.ofMinutes(3));
 * }
 * }</pre>
 *
 * @param <S> the statistics type
 */
public final class CacheEntryStatsCollector<S extends CacheEntryStats<S>> {

    private static final Logger log = LoggerFactory.getLogger(CacheEntryStatsCollector.class);

    private final ReentrantLock mutex = new ReentrantLock();
    private final StatsKind<S> kind;
    private final Cache cache;
    private final SystemClock clock;
    private final CollectorConfig config;

    // Guarded by mutex
    private final S savedStats;
    private long lastStartTimeMicros;
    private long lastEndTimeMicros;
    private boolean collected;

    private volatile boolean erased;

    CacheEntryStatsCollector(StatsKind<S> kind, Cache cache, SystemClock clock, CollectorConfig config) {
        this.kind = kind;
        this.cache = cache;
        this.clock = clock;
        this.config = config;
        this.savedStats = kind.newStats();
    }

    /**
     * Get or create the collector of {@code kind} for {@code cache}, through
     * the {@linkplain StatsCollectorFactory#getDefault() default factory}.
     *
     * @see StatsCollectorFactory#getShared(Cache, SystemClock, StatsKind)
     */
    public static <S extends CacheEntryStats<S>> SharedCacheHandle<CacheEntryStatsCollector<S>> getShared(
            Cache cache, SystemClock clock, StatsKind<S> kind) throws CacheInsertException {
        return StatsCollectorFactory.getDefault().getShared(cache, clock, kind);
    }

    /**
     * Statistics no older than the configured default maximum age.
     */
    public S getStats() {
        return getStats(config.defaultMaximumAge());
    }

    /**
     * Statistics no older than {@code maximumAge}, scanning the cache if the
     * saved results are too old.
     *
     * <p>The saved results are also considered too old once they are older
     * than {@code max(minimumRescanInterval, rescanOverheadFactor * lastScanDuration)}
     * (1 second and 100 by default), so cheap scans are repeated more often
     * than requested. A negative {@code maximumAge} counts as zero.</p>
     *
     * <p>Blocks while another thread is scanning, then returns that scan's
     * results. The returned copy always comes from a completed scan.</p>
     */
    public S getStats(Duration maximumAge) {
        Objects.requireNonNull(maximumAge, "maximumAge");
        mutex.lock();
        try {
            long maxAgeMicros = Math.min(toMicros(maximumAge), rescanIntervalMicros());

            long startTimeMicros = clock.nowMicros();
            if (!collected || startTimeMicros - lastEndTimeMicros > maxAgeMicros) {
                collect(startTimeMicros);
            } else {
                savedStats.skippedCollection();
            }
            return savedStats.copy();
        } finally {
            mutex.unlock();
        }
    }

    private void collect(long startTimeMicros) {
        // Cleared until the scan completes so a failed scan is never served
        collected = false;
        savedStats.beginCollection(cache, clock, startTimeMicros);

        cache.applyToAllEntries(savedStats.entryCallback(), ApplyToAllEntriesOptions.DEFAULT);

        long endTimeMicros = clock.nowMicros();
        lastStartTimeMicros = startTimeMicros;
        lastEndTimeMicros = endTimeMicros;
        savedStats.endCollection(cache, clock, endTimeMicros);
        collected = true;

        log.debug("Collected {} from {} in {} us", kind.name(), cache.getId(), endTimeMicros - startTimeMicros);
    }

    /**
     * Age below which saved results are reused whatever the caller asks for.
     */
    private long rescanIntervalMicros() {
        long lastDuration = lastEndTimeMicros - lastStartTimeMicros;
        long factor = config.rescanOverheadFactor();
        long scaled = factor != 0 && lastDuration > Long.MAX_VALUE / factor ? Long.MAX_VALUE : factor * lastDuration;
        return Math.max(toMicros(config.minimumRescanInterval()), scaled);
    }

    private static long toMicros(Duration duration) {
        if (duration.isNegative()) {
            return 0;
        }
        if (duration.getSeconds() >= Long.MAX_VALUE / 1_000_000L) {
            return Long.MAX_VALUE;
        }
        return TimeUnit.SECONDS.toMicros(duration.getSeconds()) + TimeUnit.NANOSECONDS.toMicros(duration.getNano());
    }

    // ============ Accessors ============

    public Cache getCache() {
        return cache;
    }

    public StatsKind<S> getKind() {
        return kind;
    }

    public CollectorConfig getConfig() {
        return config;
    }

    /**
     * Whether a scan has completed and its results are saved.
     */
    public boolean hasCollected() {
        mutex.lock();
        try {
            return collected;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Start of the last completed scan, in {@link SystemClock} microseconds.
     */
    public long lastStartTimeMicros() {
        mutex.lock();
        try {
            return lastStartTimeMicros;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * End of the last completed scan, in {@link SystemClock} microseconds.
     */
    public long lastEndTimeMicros() {
        mutex.lock();
        try {
            return lastEndTimeMicros;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Whether the cache has dropped this collector.
     */
    boolean isErased() {
        return erased;
    }

    void onErased() {
        erased = true;
        log.debug("Stats collector {} removed from {}", kind.name(), cache.getId());
    }

    @Override
    public String toString() {
        return "CacheEntryStatsCollector[" + kind.name() + " in " + cache.getId() + "]";
    }
}
