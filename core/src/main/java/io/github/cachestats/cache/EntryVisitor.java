package io.github.cachestats.cache;

/**
 * Callback applied to every live entry by {@link Cache#applyToAllEntries}.
 */
@FunctionalInterface
public interface EntryVisitor {

    void visit(CacheKey key, Object value, long charge, Deleter deleter);
}
