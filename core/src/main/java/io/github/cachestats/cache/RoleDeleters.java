package io.github.cachestats.cache;

import java.util.EnumMap;
import java.util.Map;

/**
 * Holder for the shared no-op deleters behind {@link Deleter#forRole}.
 */
final class RoleDeleters {

    private static final Map<CacheEntryRole, Deleter> BY_ROLE = new EnumMap<>(CacheEntryRole.class);

    static {
        for (CacheEntryRole role : CacheEntryRole.values()) {
            BY_ROLE.put(role, new Deleter() {
                @Override
                public void delete(CacheKey key, Object value) {
                    // nothing owned
                }

                @Override
                public CacheEntryRole role() {
                    return role;
                }

                @Override
                public String toString() {
                    return "Deleter[" + role.displayName() + "]";
                }
            });
        }
    }

    private RoleDeleters() {
    }

    static Deleter forRole(CacheEntryRole role) {
        return BY_ROLE.get(role);
    }
}
