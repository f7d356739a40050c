package io.github.cachestats.cache;

/**
 * Concurrent key to value store with handle-based reference counting.
 *
 * <p>Contract relied on by the statistics collectors:</p>
 * <ul>
 *   <li>An entry with an outstanding {@link Handle} is pinned: its
 *       {@link Deleter} does not run until every handle has been
 *       {@linkplain #release released}, even if the entry was erased or
 *       replaced meanwhile.</li>
 *   <li>{@link #insert} under an existing key replaces the entry; the cache
 *       offers no atomic insert-if-absent.</li>
 *   <li>{@link #applyToAllEntries} visits each live entry at least once, in no
 *       particular order, without isolation from concurrent inserts and
 *       erases.</li>
 * </ul>
 */
public interface Cache {

    /**
     * Opaque reference to a cache entry, obtained from {@link #lookup} or
     * {@link #insert} and given back with {@link #release}.
     */
    interface Handle {
    }

    /**
     * Look up an entry, taking a reference to it.
     *
     * @return a handle the caller must release, or {@code null} if absent
     */
    Handle lookup(CacheKey key);

    /**
     * Insert an entry and return a handle to it.
     *
     * @param charge cost debited against the capacity
     * @param deleter called with the key and value once the entry is gone
     * @return a handle the caller must release
     * @throws CacheInsertException if the entry cannot be admitted; the value
     *         was not inserted and its deleter was not called
     */
    Handle insert(CacheKey key, Object value, long charge, Deleter deleter) throws CacheInsertException;

    /**
     * Insert an entry without keeping a reference to it.
     */
    default void put(CacheKey key, Object value, long charge, Deleter deleter) throws CacheInsertException {
        release(insert(key, value, charge, deleter));
    }

    Object value(Handle handle);

    Deleter getDeleter(Handle handle);

    long getCharge(Handle handle);

    /**
     * Give back a reference obtained from {@link #lookup} or {@link #insert}.
     * After the last release an erased entry is destroyed and a resident one
     * becomes evictable.
     */
    void release(Handle handle);

    /**
     * Remove the entry under {@code key}, if any. Its deleter runs once no
     * handle to it remains.
     *
     * @return whether an entry was removed
     */
    boolean erase(CacheKey key);

    /**
     * Call {@code visitor} for every live entry. Synchronous.
     */
    void applyToAllEntries(EntryVisitor visitor, ApplyToAllEntriesOptions options);

    long getCapacity();

    /**
     * Total charge of resident entries.
     */
    long getUsage();

    /**
     * Total charge of entries with at least one outstanding handle.
     */
    long getPinnedUsage();

    /**
     * Stable, human-readable identity of this cache instance.
     */
    String getId();
}
