package io.github.cachestats.stats;

import io.github.cachestats.cache.SharedCacheHandle;
import io.github.cachestats.clock.ManualClock;
import io.github.cachestats.config.CollectorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheEntryStatsCollector refresh policy")
class CacheEntryStatsCollectorTest {

    private static final Duration THREE_MINUTES = Duration.ofSeconds(180);

    private ManualClock clock;
    private InstrumentedCache cache;
    private StatsCollectorFactory factory;

    @BeforeEach
    void setUp() throws Exception {
        clock = new ManualClock();
        cache = new InstrumentedCache();
        factory = new StatsCollectorFactory(CollectorConfig.defaults());
        cache.putData("a", 100);
        cache.putData("b", 200);
    }

    private CacheEntryStatsCollector<CountingStats> collector() throws Exception {
        try (SharedCacheHandle<CacheEntryStatsCollector<CountingStats>> guard =
                 factory.getShared(cache, clock, CountingStats.KIND)) {
            // Unpinned from here on but still resident: nothing in these tests evicts it
            return guard.get();
        }
    }

    // ============================================
    // First collection
    // ============================================

    @Test
    @DisplayName("First request always scans exactly once, whatever the maximum age")
    void firstRequestScansOnce() throws Exception {
        for (Duration maximumAge : List.of(Duration.ZERO, Duration.ofSeconds(1), THREE_MINUTES, Duration.ofDays(365))) {
            InstrumentedCache fresh = new InstrumentedCache();
            fresh.putData("x", 10);
            try (SharedCacheHandle<CacheEntryStatsCollector<CountingStats>> guard =
                     factory.getShared(fresh, clock, CountingStats.KIND)) {
                CountingStats stats = guard.get().getStats(maximumAge);

                assertEquals(1, stats.begins, "begins for " + maximumAge);
                assertEquals(1, stats.ends, "ends for " + maximumAge);
                assertEquals(0, stats.skips, "skips for " + maximumAge);
                assertEquals(1, fresh.scans.get());
                assertTrue(guard.get().hasCollected());
            }
        }
    }

    @Test
    @DisplayName("Scan sees every entry, including the collector itself")
    void scanSeesAllEntries() throws Exception {
        CountingStats stats = collector().getStats(THREE_MINUTES);

        // a, b and the zero-charge collector entry
        assertEquals(3, stats.entries);
        assertEquals(300, stats.totalCharge);
    }

    // ============================================
    // Staleness window
    // ============================================

    @Test
    @DisplayName("Request within the window is served from the saved snapshot")
    void requestWithinWindowSkips() throws Exception {
        CacheEntryStatsCollector<CountingStats> collector = collector();
        CountingStats first = collector.getStats(THREE_MINUTES);

        clock.advance(Duration.ofMillis(500));
        cache.putData("c", 300);
        CountingStats second = collector.getStats(THREE_MINUTES);

        assertEquals(1, cache.scans.get());
        assertEquals(1, second.begins);
        assertEquals(1, second.skips);
        assertTrue(second.sameSnapshotAs(first));
        assertEquals(3, second.entries, "entry added after the scan is not visible yet");
    }

    @Test
    @DisplayName("180s bound: request 1s later skips, request 200s later scans")
    void threeMinuteScenario() throws Exception {
        CacheEntryStatsCollector<CountingStats> collector = collector();
        CountingStats atZero = collector.getStats(THREE_MINUTES);

        clock.advance(Duration.ofSeconds(1));
        CountingStats atOne = collector.getStats(THREE_MINUTES);
        assertEquals(1, atOne.skips);
        assertTrue(atOne.sameSnapshotAs(atZero));

        clock.advance(Duration.ofSeconds(199));
        CountingStats atTwoHundred = collector.getStats(THREE_MINUTES);
        assertEquals(2, atTwoHundred.begins);
        assertEquals(2, cache.scans.get());
        assertEquals(clock.nowMicros(), atTwoHundred.startTimeMicros);
    }

    @Test
    @DisplayName("Request after the window scans once and returns the new results")
    void requestAfterWindowScans() throws Exception {
        CacheEntryStatsCollector<CountingStats> collector = collector();
        collector.getStats(Duration.ofSeconds(10));

        cache.putData("c", 300);
        clock.advance(Duration.ofSeconds(11));
        CountingStats stats = collector.getStats(Duration.ofSeconds(10));

        assertEquals(2, cache.scans.get());
        assertEquals(2, stats.begins);
        assertEquals(0, stats.skips);
        assertEquals(4, stats.entries);
        assertEquals(600, stats.totalCharge);
    }

    @Test
    @DisplayName("Cheap scans are repeated once per second even with a long maximum age")
    void cheapScanRepeatedAfterOneSecond() throws Exception {
        CacheEntryStatsCollector<CountingStats> collector = collector();
        collector.getStats(THREE_MINUTES);

        clock.advance(Duration.ofMillis(1_001));
        CountingStats stats = collector.getStats(THREE_MINUTES);

        assertEquals(2, stats.begins);
    }

    @Test
    @DisplayName("Snapshot is reused for 100 times the last scan's duration")
    void windowScalesWithScanDuration() throws Exception {
        cache.onScan = () -> clock.advance(Duration.ofSeconds(1));
        CacheEntryStatsCollector<CountingStats> collector = collector();
        collector.getStats(THREE_MINUTES);

        clock.advance(Duration.ofSeconds(100));
        assertEquals(1, collector.getStats(THREE_MINUTES).skips);

        clock.advanceMicros(1);
        assertEquals(2, collector.getStats(THREE_MINUTES).begins);
    }

    @Test
    @DisplayName("Regression: a non-negative maximum age is honored, not clamped to zero")
    void maximumAgeIsNotClampedToZero() throws Exception {
        cache.onScan = () -> clock.advance(Duration.ofSeconds(10));
        CacheEntryStatsCollector<CountingStats> collector = collector();
        collector.getStats(THREE_MINUTES);

        // Effective bound is min(180s, max(1s, 100 * 10s)) = 180s
        clock.advance(Duration.ofSeconds(60));
        CountingStats stats = collector.getStats(THREE_MINUTES);
        assertEquals(1, stats.begins);
        assertEquals(1, stats.skips);

        clock.advance(Duration.ofSeconds(121));
        assertEquals(2, collector.getStats(THREE_MINUTES).begins);
    }

    @Test
    @DisplayName("Negative maximum age behaves like zero")
    void negativeMaximumAgeIsZero() throws Exception {
        CacheEntryStatsCollector<CountingStats> collector = collector();
        collector.getStats(Duration.ofSeconds(-5));

        // No time has passed: the snapshot is exactly zero old
        assertEquals(1, collector.getStats(Duration.ofSeconds(-5)).skips);

        clock.advanceMicros(1);
        assertEquals(2, collector.getStats(Duration.ofSeconds(-5)).begins);
        clock.advanceMicros(1);
        assertEquals(3, collector.getStats(Duration.ZERO).begins);
    }

    @Test
    @DisplayName("getStats() uses the configured default maximum age")
    void defaultMaximumAgeFromConfig() throws Exception {
        factory = new StatsCollectorFactory(
            new CollectorConfig(Duration.ofSeconds(30), Duration.ofSeconds(1), 100));
        cache.onScan = () -> clock.advance(Duration.ofSeconds(10));
        CacheEntryStatsCollector<CountingStats> collector = collector();
        collector.getStats();

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, collector.getStats().skips);

        clock.advance(Duration.ofSeconds(1));
        assertEquals(2, collector.getStats().begins);
    }

    @Test
    @DisplayName("Scan timestamps are ordered and exposed")
    void timestampsAreOrdered() throws Exception {
        cache.onScan = () -> clock.advance(Duration.ofMillis(250));
        CacheEntryStatsCollector<CountingStats> collector = collector();
        long before = clock.nowMicros();
        CountingStats stats = collector.getStats(THREE_MINUTES);

        assertEquals(before, collector.lastStartTimeMicros());
        assertEquals(before + 250_000, collector.lastEndTimeMicros());
        assertTrue(collector.lastEndTimeMicros() >= collector.lastStartTimeMicros());
        assertEquals(collector.lastEndTimeMicros(), stats.endTimeMicros);
    }

    @Test
    @DisplayName("Returned statistics are independent copies")
    void returnsCopies() throws Exception {
        CacheEntryStatsCollector<CountingStats> collector = collector();
        CountingStats first = collector.getStats(THREE_MINUTES);
        first.entries = -1;

        CountingStats second = collector.getStats(THREE_MINUTES);
        assertEquals(3, second.entries);
        assertNotSame(first, second);
    }

    // ============================================
    // Failure
    // ============================================

    @Test
    @DisplayName("Failed scan propagates and the next request scans again")
    void failedScanIsNotServed() throws Exception {
        CacheEntryStatsCollector<CountingStats> collector = collector();
        collector.getStats(THREE_MINUTES);

        clock.advance(Duration.ofSeconds(2));
        cache.onScan = () -> {
            throw new IllegalStateException("scan failed");
        };
        assertThrows(IllegalStateException.class, () -> collector.getStats(THREE_MINUTES));
        assertFalse(collector.hasCollected());

        cache.onScan = () -> { };
        CountingStats stats = collector.getStats(THREE_MINUTES);
        assertEquals(3, stats.begins);
        assertEquals(0, stats.skips);
        assertTrue(collector.hasCollected());
    }

    // ============================================
    // Concurrency
    // ============================================

    @Test
    @DisplayName("Concurrent requests within one window share a single scan")
    void concurrentRequestsShareOneScan() throws Exception {
        int threads = 16;
        CountDownLatch scanStarted = new CountDownLatch(1);
        CountDownLatch finishScan = new CountDownLatch(1);
        cache.onScan = () -> {
            scanStarted.countDown();
            try {
                finishScan.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        CacheEntryStatsCollector<CountingStats> collector = collector();

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<CountingStats>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return collector.getStats(THREE_MINUTES);
                }));
            }
            start.countDown();
            assertTrue(scanStarted.await(5, TimeUnit.SECONDS));
            // Give the other threads time to queue up on the lock
            Thread.sleep(100);
            finishScan.countDown();

            CountingStats reference = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<CountingStats> result : results) {
                CountingStats stats = result.get(5, TimeUnit.SECONDS);
                assertEquals(1, stats.begins);
                assertTrue(stats.sameSnapshotAs(reference));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, cache.scans.get());
        // threads - 1 waiters reused the scan, plus this request
        assertEquals(threads, collector.getStats(THREE_MINUTES).skips);
    }
}
