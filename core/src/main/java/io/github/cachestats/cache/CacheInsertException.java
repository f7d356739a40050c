package io.github.cachestats.cache;

/**
 * Thrown when a {@link Cache} refuses to insert an entry, for example because
 * the capacity limit is strict and every resident entry is pinned.
 *
 * <p>Callers may retry later or fall back to uncached behavior.</p>
 */
public class CacheInsertException extends Exception {

    private final CacheKey key;

    public CacheInsertException(CacheKey key, String message) {
        super(message + " (key=" + key + ")");
        this.key = key;
    }

    public CacheKey getKey() {
        return key;
    }
}
