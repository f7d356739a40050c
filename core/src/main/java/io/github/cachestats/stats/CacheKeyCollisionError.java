package io.github.cachestats.stats;

import io.github.cachestats.cache.CacheKey;
import io.github.cachestats.cache.Deleter;

/**
 * The entry found under a stats kind's key was not created for that kind.
 *
 * <p>Signals a broken key space, not a runtime condition: continuing could hand
 * out statistics of the wrong kind, so this is an {@link Error}.</p>
 */
public class CacheKeyCollisionError extends Error {

    public CacheKeyCollisionError(String kindName, CacheKey key, Deleter found) {
        super("Entry under key " + key + " of stats kind '" + kindName
            + "' has unexpected deleter " + found);
    }
}
