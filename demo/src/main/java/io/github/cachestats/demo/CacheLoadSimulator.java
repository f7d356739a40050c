package io.github.cachestats.demo;

import io.github.cachestats.cache.Cache;
import io.github.cachestats.cache.CacheEntryRole;
import io.github.cachestats.cache.CacheInsertException;
import io.github.cachestats.cache.CacheKey;
import io.github.cachestats.cache.Deleter;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fills a cache with blocks the way a table reader would.
 *
 * <p>Block mix, by insert count:</p>
 * <ul>
 *   <li>Data blocks:   ~80%, 4-16 KB</li>
 *   <li>Index blocks:  ~10%, 1-4 KB</li>
 *   <li>Filter blocks: ~8%, 2-8 KB</li>
 *   <li>Filter partition index: ~2%, 512 B</li>
 * </ul>
 *
 * <p>Keys are drawn from a bounded key space so repeated reads hit and the
 * cache reaches a steady state.</p>
 */
public class CacheLoadSimulator {

    private static final int KB = 1024;

    private final Random random = new Random();
    private final Cache cache;
    private final int keySpace;
    private final AtomicInteger hits = new AtomicInteger(0);
    private final AtomicInteger misses = new AtomicInteger(0);
    private final AtomicInteger rejected = new AtomicInteger(0);

    public CacheLoadSimulator(Cache cache, int keySpace) {
        this.cache = cache;
        this.keySpace = keySpace;
    }

    /**
     * Read one block: a hit releases the handle, a miss loads and inserts it.
     */
    public void readBlock() {
        int id;
        synchronized (random) {
            id = random.nextInt(keySpace);
        }
        CacheEntryRole role = roleOf(id);
        CacheKey key = CacheKey.of(role.hyphenatedName() + "-" + id);

        Cache.Handle handle = cache.lookup(key);
        if (handle != null) {
            hits.incrementAndGet();
            cache.release(handle);
            return;
        }
        misses.incrementAndGet();
        try {
            cache.put(key, new byte[0], sizeOf(role, id), Deleter.forRole(role));
        } catch (CacheInsertException e) {
            // Strict caches may refuse; the read is simply served uncached
            rejected.incrementAndGet();
        }
    }

    /**
     * Role of a block, fixed per id.
     */
    static CacheEntryRole roleOf(int id) {
        int bucket = id % 50;
        if (bucket < 40) return CacheEntryRole.DATA_BLOCK;
        if (bucket < 45) return CacheEntryRole.INDEX_BLOCK;
        if (bucket < 49) return CacheEntryRole.FILTER_BLOCK;
        return CacheEntryRole.FILTER_META_BLOCK;
    }

    /**
     * Size of a block, fixed per id.
     */
    static long sizeOf(CacheEntryRole role, int id) {
        int spread = Math.floorMod(id * 31, 4);
        return switch (role) {
            case DATA_BLOCK -> (4L + 4L * spread) * KB;
            case INDEX_BLOCK -> (1L + spread) * KB;
            case FILTER_BLOCK -> (2L + 2L * spread) * KB;
            default -> KB / 2;
        };
    }

    public int getHits() {
        return hits.get();
    }

    public int getMisses() {
        return misses.get();
    }

    public int getRejected() {
        return rejected.get();
    }
}
