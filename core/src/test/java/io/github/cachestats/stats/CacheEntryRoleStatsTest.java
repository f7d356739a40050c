package io.github.cachestats.stats;

import io.github.cachestats.cache.CacheEntryRole;
import io.github.cachestats.cache.CacheKey;
import io.github.cachestats.cache.Deleter;
import io.github.cachestats.cache.LocalCache;
import io.github.cachestats.cache.SharedCacheHandle;
import io.github.cachestats.clock.ManualClock;
import io.github.cachestats.config.CacheConfig;
import io.github.cachestats.config.CollectorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheEntryRoleStats Tests")
class CacheEntryRoleStatsTest {

    private static final long CAPACITY = 4L * 1024 * 1024;

    private ManualClock clock;
    private LocalCache cache;
    private StatsCollectorFactory factory;

    @BeforeEach
    void setUp() throws Exception {
        clock = new ManualClock();
        cache = new LocalCache(new CacheConfig(CAPACITY, 0, false));
        factory = new StatsCollectorFactory(CollectorConfig.defaults());

        for (int i = 0; i < 4; i++) {
            cache.put(CacheKey.of("data-" + i), new byte[0], 256 * 1024, Deleter.forRole(CacheEntryRole.DATA_BLOCK));
        }
        cache.put(CacheKey.of("index-0"), new byte[0], 64 * 1024, Deleter.forRole(CacheEntryRole.INDEX_BLOCK));
        cache.put(CacheKey.of("filter-0"), new byte[0], 128 * 1024, Deleter.forRole(CacheEntryRole.FILTER_BLOCK));
        cache.put(CacheKey.of("opaque"), new Object(), 10, (key, value) -> { });
    }

    private CacheEntryRoleStats collect(Duration maximumAge) throws Exception {
        try (SharedCacheHandle<CacheEntryStatsCollector<CacheEntryRoleStats>> guard =
                 factory.getShared(cache, clock, CacheEntryRoleStats.KIND)) {
            return guard.get().getStats(maximumAge);
        }
    }

    @Test
    @DisplayName("Entries are counted and charged per role")
    void testPerRoleCounts() throws Exception {
        CacheEntryRoleStats stats = collect(Duration.ofMinutes(3));

        assertEquals(4, stats.getEntryCount(CacheEntryRole.DATA_BLOCK));
        assertEquals(1024 * 1024, stats.getTotalCharge(CacheEntryRole.DATA_BLOCK));
        assertEquals(1, stats.getEntryCount(CacheEntryRole.INDEX_BLOCK));
        assertEquals(64 * 1024, stats.getTotalCharge(CacheEntryRole.INDEX_BLOCK));
        assertEquals(1, stats.getEntryCount(CacheEntryRole.FILTER_BLOCK));
        // The unclassified entry plus the collector itself
        assertEquals(2, stats.getEntryCount(CacheEntryRole.MISC));
        assertEquals(10, stats.getTotalCharge(CacheEntryRole.MISC));
        assertEquals(0, stats.getEntryCount(CacheEntryRole.WRITE_BUFFER));
        assertEquals(8, stats.getTotalEntryCount());
    }

    @Test
    @DisplayName("Cache identity and capacity are captured at scan start")
    void testCacheAttributes() throws Exception {
        CacheEntryRoleStats stats = collect(Duration.ofMinutes(3));

        assertEquals(cache.getId(), stats.getCacheId());
        assertEquals(CAPACITY, stats.getCacheCapacity());
        assertEquals(cache.getUsage(), stats.getCacheUsage());
        assertEquals(clock.nowMicros(), stats.getLastStartTimeMicros());
        assertEquals(0, stats.getLastDurationMicros());
    }

    @Test
    @DisplayName("Copies counter grows on reuse and resets on a new scan")
    void testCollectionCounters() throws Exception {
        CacheEntryRoleStats first = collect(Duration.ofMinutes(3));
        assertEquals(1, first.getCollectionCount());
        assertEquals(0, first.getCopiesOfLastCollection());

        clock.advance(Duration.ofMillis(100));
        collect(Duration.ofMinutes(3));
        CacheEntryRoleStats reused = collect(Duration.ofMinutes(3));
        assertEquals(1, reused.getCollectionCount());
        assertEquals(2, reused.getCopiesOfLastCollection());

        clock.advance(Duration.ofSeconds(2));
        CacheEntryRoleStats rescanned = collect(Duration.ofMinutes(3));
        assertEquals(2, rescanned.getCollectionCount());
        assertEquals(0, rescanned.getCopiesOfLastCollection());
    }

    @Test
    @DisplayName("Property map uses hyphenated role names")
    void testToMap() throws Exception {
        CacheEntryRoleStats stats = collect(Duration.ofMinutes(3));
        clock.advance(Duration.ofSeconds(7));

        Map<String, String> map = stats.toMap(clock);

        assertEquals(cache.getId(), map.get("id"));
        assertEquals(Long.toString(CAPACITY), map.get("capacity"));
        assertEquals("0.000", map.get("secs_for_last_collection"));
        assertEquals("7", map.get("secs_since_last_collection"));
        assertEquals("4", map.get("count.data-block"));
        assertEquals(Long.toString(1024 * 1024), map.get("bytes.data-block"));
        assertEquals("25.00", map.get("percent.data-block"));
        assertEquals("0", map.get("count.write-buffer"));
        assertTrue(map.containsKey("percent.compression-dictionary-building-buffer"));
        assertEquals(4 + 3 * CacheEntryRole.values().length, map.size());
    }

    @Test
    @DisplayName("Formatted summary lists only roles with entries")
    void testFormat() throws Exception {
        CacheEntryRoleStats stats = collect(Duration.ofMinutes(3));

        String text = stats.format(clock);
        String[] lines = text.split("\n");

        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("Block cache " + cache.getId() + " capacity: 4.00 MB"), lines[0]);
        assertTrue(lines[0].contains("collections: 1"), lines[0]);
        assertTrue(lines[1].contains("DataBlock(4,1.00 MB,25.00%)"), lines[1]);
        assertTrue(lines[1].contains("IndexBlock(1,64.00 KB,1.56%)"), lines[1]);
        assertFalse(lines[1].contains("WriteBuffer"), lines[1]);
    }

    @Test
    @DisplayName("Byte sizes are rendered in KB, MB or GB")
    void testHumanBytes() {
        assertEquals("0.00 KB", CacheEntryRoleStats.humanBytes(0));
        assertEquals("1.50 KB", CacheEntryRoleStats.humanBytes(1536));
        assertEquals("32.00 MB", CacheEntryRoleStats.humanBytes(32L * 1024 * 1024));
        assertEquals("2.00 GB", CacheEntryRoleStats.humanBytes(2L * 1024 * 1024 * 1024));
    }

    @Test
    @DisplayName("Copies are equal to but independent of each other")
    void testCopy() throws Exception {
        CacheEntryRoleStats stats = collect(Duration.ofMinutes(3));
        CacheEntryRoleStats copy = stats.copy();

        assertEquals(stats, copy);
        assertEquals(stats.hashCode(), copy.hashCode());
        copy.skippedCollection();
        assertNotEquals(stats, copy);
    }
}
