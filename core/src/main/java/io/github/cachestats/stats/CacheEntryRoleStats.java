package io.github.cachestats.stats;

import io.github.cachestats.cache.Cache;
import io.github.cachestats.cache.CacheEntryRole;
import io.github.cachestats.cache.EntryVisitor;
import io.github.cachestats.clock.SystemClock;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Entry count and total charge of a cache per {@link CacheEntryRole}.
 *
 * <p>The role of an entry is that of its deleter, so entries inserted with
 * {@link io.github.cachestats.cache.Deleter#forRole} are classified; all others
 * count as {@link CacheEntryRole#MISC}.</p>
 *
 * <p>Typical output of {@link #format(SystemClock)}:</p>
 * <pre>
 * Block cache LocalCache-1 capacity: 32.00 MB collections: 4 last_copies: 2 last_secs: 0.001 secs_since: 12
 * Block cache entry stats(count,size,portion): DataBlock(412,12.88 MB,40.25%) IndexBlock(9,288.00 KB,0.88%) Misc(1,0.00 KB,0.00%)
 * </pre>
 */
public final class CacheEntryRoleStats implements CacheEntryStats<CacheEntryRoleStats> {

    public static final StatsKind<CacheEntryRoleStats> KIND =
        StatsKind.declare("cache-entry-role-stats", CacheEntryRoleStats::new);

    private static final CacheEntryRole[] ROLES = CacheEntryRole.values();

    private String cacheId = "";
    private long cacheCapacity;
    private long cacheUsage;
    private long[] entryCounts = new long[ROLES.length];
    private long[] totalCharges = new long[ROLES.length];
    private long lastStartTimeMicros;
    private long lastEndTimeMicros;
    private int collectionCount;
    private int copiesOfLastCollection;

    public CacheEntryRoleStats() {
    }

    private CacheEntryRoleStats(CacheEntryRoleStats other) {
        this.cacheId = other.cacheId;
        this.cacheCapacity = other.cacheCapacity;
        this.cacheUsage = other.cacheUsage;
        this.entryCounts = other.entryCounts.clone();
        this.totalCharges = other.totalCharges.clone();
        this.lastStartTimeMicros = other.lastStartTimeMicros;
        this.lastEndTimeMicros = other.lastEndTimeMicros;
        this.collectionCount = other.collectionCount;
        this.copiesOfLastCollection = other.copiesOfLastCollection;
    }

    // ============ Collection ============

    @Override
    public void beginCollection(Cache cache, SystemClock clock, long startTimeMicros) {
        Arrays.fill(entryCounts, 0);
        Arrays.fill(totalCharges, 0);
        copiesOfLastCollection = 0;
        collectionCount++;
        lastStartTimeMicros = startTimeMicros;
        cacheId = cache.getId();
        cacheCapacity = cache.getCapacity();
        cacheUsage = cache.getUsage();
    }

    @Override
    public EntryVisitor entryCallback() {
        return (key, value, charge, deleter) -> {
            int role = deleter.role().ordinal();
            entryCounts[role]++;
            totalCharges[role] += charge;
        };
    }

    @Override
    public void endCollection(Cache cache, SystemClock clock, long endTimeMicros) {
        lastEndTimeMicros = endTimeMicros;
    }

    @Override
    public void skippedCollection() {
        copiesOfLastCollection++;
    }

    @Override
    public CacheEntryRoleStats copy() {
        return new CacheEntryRoleStats(this);
    }

    // ============ Accessors ============

    public String getCacheId() {
        return cacheId;
    }

    public long getCacheCapacity() {
        return cacheCapacity;
    }

    public long getCacheUsage() {
        return cacheUsage;
    }

    public long getEntryCount(CacheEntryRole role) {
        return entryCounts[role.ordinal()];
    }

    public long getTotalCharge(CacheEntryRole role) {
        return totalCharges[role.ordinal()];
    }

    /**
     * Number of entries seen by the last scan, all roles.
     */
    public long getTotalEntryCount() {
        return Arrays.stream(entryCounts).sum();
    }

    public long getLastStartTimeMicros() {
        return lastStartTimeMicros;
    }

    public long getLastEndTimeMicros() {
        return lastEndTimeMicros;
    }

    public long getLastDurationMicros() {
        return lastEndTimeMicros - lastStartTimeMicros;
    }

    /**
     * Number of scans these statistics went through.
     */
    public int getCollectionCount() {
        return collectionCount;
    }

    /**
     * Number of requests served from the last scan without scanning again.
     */
    public int getCopiesOfLastCollection() {
        return copiesOfLastCollection;
    }

    // ============ Output ============

    /**
     * Flat property map. Keys: {@code id}, {@code capacity},
     * {@code secs_for_last_collection}, {@code secs_since_last_collection},
     * and per role {@code count.<role>}, {@code bytes.<role>},
     * {@code percent.<role>} with hyphenated role names.
     */
    public Map<String, String> toMap(SystemClock clock) {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("id", cacheId);
        map.put("capacity", Long.toString(cacheCapacity));
        map.put("secs_for_last_collection", formatSeconds(getLastDurationMicros()));
        map.put("secs_since_last_collection", Long.toString(secondsSince(clock)));
        for (CacheEntryRole role : ROLES) {
            String name = role.hyphenatedName();
            map.put("count." + name, Long.toString(getEntryCount(role)));
            map.put("bytes." + name, Long.toString(getTotalCharge(role)));
            map.put("percent." + name, String.format(Locale.ROOT, "%.2f", percentOfCapacity(getTotalCharge(role))));
        }
        return map;
    }

    /**
     * Two-line human-readable summary; roles without entries are left out.
     */
    public String format(SystemClock clock) {
        StringBuilder sb = new StringBuilder();
        sb.append("Block cache ").append(cacheId)
            .append(" capacity: ").append(humanBytes(cacheCapacity))
            .append(" collections: ").append(collectionCount)
            .append(" last_copies: ").append(copiesOfLastCollection)
            .append(" last_secs: ").append(formatSeconds(getLastDurationMicros()))
            .append(" secs_since: ").append(secondsSince(clock))
            .append('\n');
        sb.append("Block cache entry stats(count,size,portion):");
        for (CacheEntryRole role : ROLES) {
            long count = getEntryCount(role);
            if (count > 0) {
                sb.append(' ').append(role.displayName())
                    .append('(').append(count)
                    .append(',').append(humanBytes(getTotalCharge(role)))
                    .append(',').append(String.format(Locale.ROOT, "%.2f%%", percentOfCapacity(getTotalCharge(role))))
                    .append(')');
            }
        }
        return sb.toString();
    }

    private long secondsSince(SystemClock clock) {
        return Math.max(0, clock.nowMicros() - lastEndTimeMicros) / 1_000_000L;
    }

    private double percentOfCapacity(long bytes) {
        return cacheCapacity == 0 ? 0.0 : 100.0 * bytes / cacheCapacity;
    }

    private static String formatSeconds(long micros) {
        return String.format(Locale.ROOT, "%.3f", micros / 1_000_000.0);
    }

    static String humanBytes(long bytes) {
        final long kb = 1024;
        final long mb = kb * 1024;
        final long gb = mb * 1024;
        if (bytes >= gb) return String.format(Locale.ROOT, "%.2f GB", (double) bytes / gb);
        if (bytes >= mb) return String.format(Locale.ROOT, "%.2f MB", (double) bytes / mb);
        return String.format(Locale.ROOT, "%.2f KB", (double) bytes / kb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheEntryRoleStats other)) return false;
        return cacheCapacity == other.cacheCapacity
            && cacheUsage == other.cacheUsage
            && lastStartTimeMicros == other.lastStartTimeMicros
            && lastEndTimeMicros == other.lastEndTimeMicros
            && collectionCount == other.collectionCount
            && copiesOfLastCollection == other.copiesOfLastCollection
            && cacheId.equals(other.cacheId)
            && Arrays.equals(entryCounts, other.entryCounts)
            && Arrays.equals(totalCharges, other.totalCharges);
    }

    @Override
    public int hashCode() {
        int result = cacheId.hashCode();
        result = 31 * result + Long.hashCode(lastEndTimeMicros);
        result = 31 * result + collectionCount;
        result = 31 * result + Arrays.hashCode(entryCounts);
        result = 31 * result + Arrays.hashCode(totalCharges);
        return result;
    }

    @Override
    public String toString() {
        return "CacheEntryRoleStats[cache=" + cacheId + ", entries=" + getTotalEntryCount()
            + ", collections=" + collectionCount + ", copies=" + copiesOfLastCollection + "]";
    }
}
