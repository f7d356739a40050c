package io.github.cachestats.stats;

import io.github.cachestats.cache.CacheEntryRole;
import io.github.cachestats.cache.CacheKey;
import io.github.cachestats.cache.Deleter;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Declared identity of one kind of {@link CacheEntryStats}.
 *
 * <p>Each kind has one collector per cache, stored under {@link #key()}. The
 * key is 24 bytes: a 16-byte prefix reserved for stats collectors and the
 * 64-bit FNV-1a hash of the kind's name, so it is the same in every cache and
 * every process. Declare kinds once, as constants:</p>
 *
 * <pre>{@code
 * public static final StatsKind<MyStats> KIND = StatsKind.declare("my-stats", MyStats::new);
 * }</pre>
 *
 * <p>A second declaration with an already used name, or with a name whose key
 * is already taken, is rejected.</p>
 *
 * @param <S> the statistics type
 */
public final class StatsKind<S extends CacheEntryStats<S>> {

    private static final long PREFIX_HIGH = 0x7eba5a8fb5437c90L;
    private static final long PREFIX_LOW = 0x8ca68c9b11655855L;

    /** Leading 16 bytes of every stats collector key. */
    public static final CacheKey KEY_PREFIX = CacheKey.ofLongs(PREFIX_HIGH, PREFIX_LOW);

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final Map<String, StatsKind<?>> DECLARED = new HashMap<>();
    private static final Map<CacheKey, String> KEYS = new HashMap<>();

    private final String name;
    private final Supplier<S> factory;
    private final CacheKey key;
    private final Deleter deleter;

    private StatsKind(String name, Supplier<S> factory) {
        this.name = name;
        this.factory = factory;
        this.key = keyFor(name);
        this.deleter = new CollectorDeleter(name);
    }

    /**
     * Declare a statistics kind.
     *
     * @param name unique, stable name
     * @param factory creates empty statistics
     * @throws IllegalArgumentException if the name or its key is already declared
     */
    public static <S extends CacheEntryStats<S>> StatsKind<S> declare(String name, Supplier<S> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stats kind name cannot be null or blank");
        }
        Objects.requireNonNull(factory, "factory");
        synchronized (DECLARED) {
            if (DECLARED.containsKey(name)) {
                throw new IllegalArgumentException("Stats kind already declared: " + name);
            }
            StatsKind<S> kind = new StatsKind<>(name, factory);
            String clash = KEYS.get(kind.key);
            if (clash != null) {
                throw new IllegalArgumentException("Stats kind '" + name + "' hashes to the key of '" + clash + "'");
            }
            DECLARED.put(name, kind);
            KEYS.put(kind.key, name);
            return kind;
        }
    }

    /**
     * Find a declared kind by name.
     */
    public static Optional<StatsKind<?>> forName(String name) {
        synchronized (DECLARED) {
            return Optional.ofNullable(DECLARED.get(name));
        }
    }

    /**
     * Key of this kind's collector, identical in every cache.
     */
    static CacheKey keyFor(String name) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return CacheKey.ofLongs(PREFIX_HIGH, PREFIX_LOW, hash);
    }

    public String name() {
        return name;
    }

    public CacheKey key() {
        return key;
    }

    /**
     * Deleter attached to this kind's collector entries. Unique per kind, it
     * is how an entry found under {@link #key()} is recognized.
     */
    public Deleter deleter() {
        return deleter;
    }

    /**
     * Fresh, empty statistics.
     */
    public S newStats() {
        return factory.get();
    }

    @Override
    public String toString() {
        return "StatsKind[" + name + "]";
    }

    private static final class CollectorDeleter implements Deleter {
        private final String kindName;

        CollectorDeleter(String kindName) {
            this.kindName = kindName;
        }

        @Override
        public void delete(CacheKey key, Object value) {
            ((CacheEntryStatsCollector<?>) value).onErased();
        }

        @Override
        public CacheEntryRole role() {
            return CacheEntryRole.MISC;
        }

        @Override
        public String toString() {
            return "Deleter[stats collector " + kindName + "]";
        }
    }
}
