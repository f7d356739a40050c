package io.github.cachestats.cache;

/**
 * Cleanup callback attached to a cache entry, run once the entry has left the
 * cache and no handle to it remains.
 *
 * <p>Deleters are compared by identity: the deleter of an entry tells what
 * kind of object the entry holds.</p>
 */
@FunctionalInterface
public interface Deleter {

    void delete(CacheKey key, Object value);

    /**
     * Role of the entries carrying this deleter.
     */
    default CacheEntryRole role() {
        return CacheEntryRole.MISC;
    }

    /**
     * Shared no-op deleter for entries of the given role. Repeated calls with
     * the same role return the same instance.
     */
    static Deleter forRole(CacheEntryRole role) {
        return RoleDeleters.forRole(role);
    }
}
