package io.github.cachestats.stats;

import io.github.cachestats.cache.Cache;
import io.github.cachestats.cache.EntryVisitor;
import io.github.cachestats.clock.SystemClock;

/**
 * Accumulator filled by a full scan of a cache.
 *
 * <p>A {@link CacheEntryStatsCollector} keeps one instance, brackets each scan
 * with {@link #beginCollection} and {@link #endCollection}, and hands out
 * {@linkplain #copy() copies}. All methods are called while the collector's
 * lock is held, so implementations need no synchronization of their own.</p>
 *
 * @param <S> the implementing type
 */
public interface CacheEntryStats<S extends CacheEntryStats<S>> {

    /**
     * Called right before a scan; may reset accumulated state.
     */
    void beginCollection(Cache cache, SystemClock clock, long startTimeMicros);

    /**
     * Visitor applied to every live entry during the scan.
     */
    EntryVisitor entryCallback();

    /**
     * Called right after the scan.
     */
    void endCollection(Cache cache, SystemClock clock, long endTimeMicros);

    /**
     * Called instead of a scan when the saved results were recent enough.
     */
    void skippedCollection();

    /**
     * Independent, value-identical copy.
     */
    S copy();
}
