package io.github.cachestats.stats;

import io.github.cachestats.cache.Cache;
import io.github.cachestats.cache.CacheInsertException;
import io.github.cachestats.cache.CacheKey;
import io.github.cachestats.cache.Deleter;
import io.github.cachestats.cache.SharedCacheHandle;
import io.github.cachestats.clock.SystemClock;
import io.github.cachestats.config.CollectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Finds or creates the single {@link CacheEntryStatsCollector} of a stats kind
 * in a cache.
 *
 * <p>The collector is stored in the cache as an entry with zero charge, under
 * the kind's key. The {@link Cache} has no atomic insert-if-absent, so
 * creation re-checks under a creation lock; that lock is shared by all kinds
 * and all factories, and held only around the lookup and insert. Callers
 * racing to create the same collector all end up with the same instance,
 * whichever factory they go through.</p>
 *
 * <p>A factory's {@link CollectorConfig} applies to the collectors it creates.
 * A collector that already exists keeps the config it was created with.</p>
 */
public class StatsCollectorFactory {

    private static final Logger log = LoggerFactory.getLogger(StatsCollectorFactory.class);

    private static final ReentrantLock SHARED_CREATION_LOCK = new ReentrantLock();

    private static final StatsCollectorFactory DEFAULT = new StatsCollectorFactory(CollectorConfig.defaults());

    private final ReentrantLock creationLock;
    private final CollectorConfig config;

    /**
     * Create a factory whose collectors follow {@code config}.
     */
    public StatsCollectorFactory(CollectorConfig config) {
        this(config, SHARED_CREATION_LOCK);
    }

    /**
     * Factory with its own creation lock. Only for tests that need creation
     * isolated from every other factory.
     */
    StatsCollectorFactory(CollectorConfig config, ReentrantLock creationLock) {
        this.config = Objects.requireNonNull(config, "config");
        this.creationLock = Objects.requireNonNull(creationLock, "creationLock");
    }

    /**
     * Process-wide factory with the default {@link CollectorConfig}.
     */
    public static StatsCollectorFactory getDefault() {
        return DEFAULT;
    }

    /**
     * Get or create the collector of {@code kind} for {@code cache}.
     *
     * <p>The returned guard pins the collector in the cache until it and every
     * {@linkplain SharedCacheHandle#share() share} of it are closed.</p>
     *
     * @param clock time source of a newly created collector; an existing
     *        collector keeps the clock it was created with
     * @throws CacheInsertException if the cache refuses the new collector
     * @throws CacheKeyCollisionError if the entry under the kind's key was not
     *         created for this kind
     */
    public <S extends CacheEntryStats<S>> SharedCacheHandle<CacheEntryStatsCollector<S>> getShared(
            Cache cache, SystemClock clock, StatsKind<S> kind) throws CacheInsertException {
        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(kind, "kind");

        CacheKey key = kind.key();
        Cache.Handle handle = cache.lookup(key);
        if (handle == null) {
            creationLock.lock();
            try {
                handle = cache.lookup(key);
                if (handle == null) {
                    handle = insertCollector(cache, clock, kind);
                }
            } finally {
                creationLock.unlock();
            }
        }

        Deleter deleter = cache.getDeleter(handle);
        if (deleter != kind.deleter()) {
            cache.release(handle);
            CacheKeyCollisionError error = new CacheKeyCollisionError(kind.name(), key, deleter);
            log.error("Stats collector key collision in {}", cache.getId(), error);
            throw error;
        }

        return SharedCacheHandle.<CacheEntryStatsCollector<S>>wrap(cache, handle, CacheEntryStatsCollector.class);
    }

    private <S extends CacheEntryStats<S>> Cache.Handle insertCollector(
            Cache cache, SystemClock clock, StatsKind<S> kind) throws CacheInsertException {
        CacheEntryStatsCollector<S> collector = new CacheEntryStatsCollector<>(kind, cache, clock, config);
        // TODO: charge the size of the saved stats so collectors count against capacity
        long charge = 0;
        try {
            Cache.Handle handle = cache.insert(kind.key(), collector, charge, kind.deleter());
            log.debug("Created stats collector {} in {}", kind.name(), cache.getId());
            return handle;
        } catch (CacheInsertException e) {
            log.warn("Could not insert stats collector {} into {}: {}", kind.name(), cache.getId(), e.getMessage());
            throw e;
        }
    }

    public CollectorConfig getConfig() {
        return config;
    }
}
