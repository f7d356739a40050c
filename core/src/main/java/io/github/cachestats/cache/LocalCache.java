package io.github.cachestats.cache;

import io.github.cachestats.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sharded, charge-bounded LRU cache implementing the {@link Cache} contract.
 *
 * <p>Each shard owns {@code capacity / shards} of the capacity (rounded up), a
 * lock and an access-ordered table. Entries with an outstanding handle are
 * pinned and never evicted; when room is needed the least recently used
 * unpinned entries go first.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * LocalCache cache = new LocalCache(CacheConfig.ofCapacity(64 << 20));
 *
 * cache.put(CacheKey.of("block-17"), block, block.length,
 *     Deleter.forRole(CacheEntryRole.DATA_BLOCK));
 *
 * Cache.Handle h = cache.lookup(CacheKey.of("block-17"));
 * if (h != null) {
 *     try {
 *         byte[] cached = (byte[]) cache.value(h);
 *     } finally {
 *         cache.release(h);
 *     }
 * }
 * }</pre>
 *
 * <p>Deleters are always invoked after the shard lock has been released.</p>
 */
public class LocalCache implements Cache {

    private static final Logger log = LoggerFactory.getLogger(LocalCache.class);

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final String id;
    private final Shard[] shards;
    private final int shardMask;
    private final boolean strictCapacityLimit;
    private volatile long capacity;

    /**
     * Create a cache from its configuration.
     */
    public LocalCache(CacheConfig config) {
        this.id = "LocalCache-" + NEXT_ID.getAndIncrement();
        int numShards = 1 << config.numShardBits();
        this.shards = new Shard[numShards];
        for (int i = 0; i < numShards; i++) {
            shards[i] = new Shard();
        }
        this.shardMask = numShards - 1;
        this.strictCapacityLimit = config.strictCapacityLimit();
        setCapacity(config.capacity());
    }

    /**
     * Create a non-strict cache with the default shard count.
     */
    public LocalCache(long capacity) {
        this(CacheConfig.ofCapacity(capacity));
    }

    // ============ Lookup / Insert / Release ============

    @Override
    public Handle lookup(CacheKey key) {
        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            CacheEntry entry = shard.table.get(key);
            if (entry == null) {
                return null;
            }
            shard.ref(entry);
            return entry;
        } finally {
            shard.lock.unlock();
        }
    }

    @Override
    public Handle insert(CacheKey key, Object value, long charge, Deleter deleter) throws CacheInsertException {
        if (charge < 0) {
            throw new IllegalArgumentException("charge must not be negative: " + charge);
        }
        CacheEntry entry = new CacheEntry(key, value, charge, deleter);
        Shard shard = shardFor(key);
        List<CacheEntry> deleted = new ArrayList<>();
        shard.lock.lock();
        try {
            shard.evictUnreferenced(charge, deleted);
            if (strictCapacityLimit && shard.usage + charge > shard.capacity) {
                log.debug("{}: rejecting insert of {} bytes, shard usage {} of {}",
                    id, charge, shard.usage, shard.capacity);
                throw new CacheInsertException(key, "Insert failed due to cache being full");
            }
            CacheEntry previous = shard.table.put(key, entry);
            if (previous != null) {
                shard.detach(previous);
                if (previous.refs == 0) {
                    deleted.add(previous);
                }
            }
            entry.inCache = true;
            shard.usage += charge;
            shard.ref(entry);
            return entry;
        } finally {
            shard.lock.unlock();
            runDeleters(deleted);
        }
    }

    @Override
    public Object value(Handle handle) {
        return asEntry(handle).value;
    }

    @Override
    public Deleter getDeleter(Handle handle) {
        return asEntry(handle).deleter;
    }

    @Override
    public long getCharge(Handle handle) {
        return asEntry(handle).charge;
    }

    @Override
    public void release(Handle handle) {
        CacheEntry entry = asEntry(handle);
        Shard shard = shardFor(entry.key);
        boolean destroy = false;
        shard.lock.lock();
        try {
            if (entry.refs <= 0) {
                throw new IllegalStateException("Handle released more often than acquired: " + entry);
            }
            entry.refs--;
            if (entry.refs == 0) {
                shard.pinnedUsage -= entry.charge;
                if (!entry.inCache) {
                    destroy = true;
                } else if (shard.usage > shard.capacity) {
                    // Over capacity: drop it right away rather than on the next insert
                    shard.table.remove(entry.key);
                    shard.detach(entry);
                    destroy = true;
                }
            }
        } finally {
            shard.lock.unlock();
        }
        if (destroy) {
            entry.delete();
        }
    }

    // ============ Erase ============

    @Override
    public boolean erase(CacheKey key) {
        Shard shard = shardFor(key);
        CacheEntry removed;
        shard.lock.lock();
        try {
            removed = shard.table.remove(key);
            if (removed == null) {
                return false;
            }
            shard.detach(removed);
            if (removed.refs > 0) {
                removed = null;
            }
        } finally {
            shard.lock.unlock();
        }
        if (removed != null) {
            removed.delete();
        }
        return true;
    }

    /**
     * Remove every entry that no handle references.
     *
     * @return number of entries removed
     */
    public int eraseUnreferencedEntries() {
        int count = 0;
        for (Shard shard : shards) {
            List<CacheEntry> deleted = new ArrayList<>();
            shard.lock.lock();
            try {
                Iterator<CacheEntry> it = shard.table.values().iterator();
                while (it.hasNext()) {
                    CacheEntry entry = it.next();
                    if (entry.refs == 0) {
                        it.remove();
                        shard.detach(entry);
                        deleted.add(entry);
                    }
                }
            } finally {
                shard.lock.unlock();
                runDeleters(deleted);
            }
            count += deleted.size();
        }
        return count;
    }

    // ============ Traversal ============

    /**
     * {@inheritDoc}
     *
     * <p>Each shard's entries are snapshotted, then re-checked under the shard
     * lock {@code averageEntriesPerLock} at a time; entries still resident are
     * handed to {@code visitor} outside the lock. Entries inserted during the
     * traversal may or may not be visited.</p>
     */
    @Override
    public void applyToAllEntries(EntryVisitor visitor, ApplyToAllEntriesOptions options) {
        int batchSize = options.averageEntriesPerLock();
        for (Shard shard : shards) {
            CacheEntry[] snapshot;
            shard.lock.lock();
            try {
                snapshot = shard.table.values().toArray(new CacheEntry[0]);
            } finally {
                shard.lock.unlock();
            }

            List<CacheEntry> batch = new ArrayList<>(Math.min(batchSize, snapshot.length));
            for (int start = 0; start < snapshot.length; start += batchSize) {
                int end = Math.min(snapshot.length, start + batchSize);
                batch.clear();
                shard.lock.lock();
                try {
                    for (int i = start; i < end; i++) {
                        if (snapshot[i].inCache) {
                            batch.add(snapshot[i]);
                        }
                    }
                } finally {
                    shard.lock.unlock();
                }
                for (CacheEntry entry : batch) {
                    visitor.visit(entry.key, entry.value, entry.charge, entry.deleter);
                }
            }
        }
    }

    // ============ Accounting ============

    @Override
    public long getCapacity() {
        return capacity;
    }

    /**
     * Change the capacity, evicting unpinned entries if it shrinks.
     */
    public void setCapacity(long capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        long perShard = (capacity + shards.length - 1) / shards.length;
        for (Shard shard : shards) {
            List<CacheEntry> deleted = new ArrayList<>();
            shard.lock.lock();
            try {
                shard.capacity = perShard;
                shard.evictUnreferenced(0, deleted);
            } finally {
                shard.lock.unlock();
                runDeleters(deleted);
            }
        }
    }

    public boolean hasStrictCapacityLimit() {
        return strictCapacityLimit;
    }

    @Override
    public long getUsage() {
        long usage = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                usage += shard.usage;
            } finally {
                shard.lock.unlock();
            }
        }
        return usage;
    }

    @Override
    public long getPinnedUsage() {
        long pinned = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                pinned += shard.pinnedUsage;
            } finally {
                shard.lock.unlock();
            }
        }
        return pinned;
    }

    /**
     * Number of resident entries.
     */
    public int size() {
        int size = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                size += shard.table.size();
            } finally {
                shard.lock.unlock();
            }
        }
        return size;
    }

    public int getNumShards() {
        return shards.length;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return id + "[capacity=" + capacity + ", shards=" + shards.length + "]";
    }

    // ============ Internal Methods ============

    private Shard shardFor(CacheKey key) {
        int h = key.hashCode();
        return shards[(h ^ (h >>> 16)) & shardMask];
    }

    private static CacheEntry asEntry(Handle handle) {
        if (!(handle instanceof CacheEntry entry)) {
            throw new IllegalArgumentException("Handle does not belong to a LocalCache: " + handle);
        }
        return entry;
    }

    private static void runDeleters(List<CacheEntry> entries) {
        for (CacheEntry entry : entries) {
            entry.delete();
        }
    }

    // ============ Inner Classes ============

    private final class Shard {
        final ReentrantLock lock = new ReentrantLock();
        final LinkedHashMap<CacheKey, CacheEntry> table = new LinkedHashMap<>(16, 0.75f, true);
        long capacity;
        long usage;
        long pinnedUsage;

        void ref(CacheEntry entry) {
            if (entry.refs == 0) {
                pinnedUsage += entry.charge;
            }
            entry.refs++;
        }

        /** Mark an entry that was just removed from the table as no longer resident. */
        void detach(CacheEntry entry) {
            entry.inCache = false;
            usage -= entry.charge;
        }

        /** Evict least recently used unpinned entries until {@code extra} more fits. */
        void evictUnreferenced(long extra, List<CacheEntry> deleted) {
            if (usage + extra <= capacity) {
                return;
            }
            int evicted = 0;
            Iterator<Map.Entry<CacheKey, CacheEntry>> it = table.entrySet().iterator();
            while (usage + extra > capacity && it.hasNext()) {
                CacheEntry entry = it.next().getValue();
                if (entry.isEvictable()) {
                    it.remove();
                    detach(entry);
                    deleted.add(entry);
                    evicted++;
                }
            }
            if (evicted > 0) {
                log.debug("{}: evicted {} entries, shard usage now {} of {}", id, evicted, usage, capacity);
            }
        }
    }
}
