package io.github.cachestats.cache;

/**
 * Cache entry with value, charge and reference count.
 *
 * <p>{@code refs} and {@code inCache} are guarded by the lock of the owning
 * {@link LocalCache} shard.</p>
 */
final class CacheEntry implements Cache.Handle {

    final CacheKey key;
    final Object value;
    final long charge;
    final Deleter deleter;

    int refs;
    boolean inCache;

    CacheEntry(CacheKey key, Object value, long charge, Deleter deleter) {
        this.key = key;
        this.value = value;
        this.charge = charge;
        this.deleter = deleter;
    }

    /**
     * Whether this entry may be evicted: resident and not pinned by a handle.
     */
    boolean isEvictable() {
        return inCache && refs == 0;
    }

    void delete() {
        deleter.delete(key, value);
    }

    @Override
    public String toString() {
        return "CacheEntry[key=" + key + ", charge=" + charge + ", refs=" + refs + ", inCache=" + inCache + "]";
    }
}
