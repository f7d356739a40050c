package io.github.cachestats.demo;

import io.github.cachestats.cache.CacheInsertException;
import io.github.cachestats.cache.LocalCache;
import io.github.cachestats.cache.SharedCacheHandle;
import io.github.cachestats.clock.SystemClock;
import io.github.cachestats.config.CacheStatsConfig;
import io.github.cachestats.config.ConfigLoader;
import io.github.cachestats.stats.CacheEntryRoleStats;
import io.github.cachestats.stats.CacheEntryStatsCollector;
import io.github.cachestats.stats.StatsCollectorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared cache statistics under load.
 *
 * <p>One block cache is shared by several partitions. Each partition asks for
 * cache entry statistics on its own schedule, the way a per-partition stats
 * dumper would:</p>
 * <ul>
 *   <li>Runs for 30 seconds</li>
 *   <li>Readers keep filling the cache with data, index and filter blocks</li>
 *   <li>8 partitions request statistics every 100 ms</li>
 *   <li>All partitions share one collector, so the cache is scanned far less
 *       often than statistics are requested</li>
 * </ul>
 *
 * <h2>Usage Pattern</h2>
 * <pre>{@code
 * try (SharedCacheHandle<CacheEntryStatsCollector<CacheEntryRoleStats>> guard =
 *          factory.getShared(cache, SystemClock.getDefault(), CacheEntryRoleStats.KIND)) {
 *     CacheEntryRoleStats stats = guard.get().getStats(Duration.ofMinutes(3));
 *     System.out.println(stats.format(SystemClock.getDefault()));
 * }
 * }</pre>
 */
public class CacheStatsDemo {

    private static final Logger log = LoggerFactory.getLogger(CacheStatsDemo.class);

    private static final int PARTITIONS = 8;
    private static final int READERS = 16;
    private static final Duration MAXIMUM_AGE = Duration.ofMinutes(3);

    private static final AtomicInteger statsRequests = new AtomicInteger(0);

    public static void main(String[] args) throws IOException, CacheInsertException, InterruptedException {
        System.out.println("========================================");
        System.out.println("Cache Entry Stats - Shared Collector Demo");
        System.out.println("========================================");
        System.out.printf("%d readers, %d partitions requesting stats every 100 ms%n", READERS, PARTITIONS);
        System.out.println("Demo runs for 30 seconds\n");

        CacheStatsConfig config = args.length > 0
            ? ConfigLoader.fromFile(Path.of(args[0]))
            : ConfigLoader.fromResource("cachestats-defaults.json");
        LocalCache cache = new LocalCache(config.cache());
        StatsCollectorFactory factory = new StatsCollectorFactory(config.collector());
        SystemClock clock = SystemClock.getDefault();
        CacheLoadSimulator simulator = new CacheLoadSimulator(cache, 20_000);

        // Held for the whole run, like an open database holds its collector
        try (SharedCacheHandle<CacheEntryStatsCollector<CacheEntryRoleStats>> pinned =
                 factory.getShared(cache, clock, CacheEntryRoleStats.KIND)) {
            log.info("Collector for {} pinned in {}", pinned.get().getKind().name(), cache.getId());

            ExecutorService readers = Executors.newFixedThreadPool(READERS);
            ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(PARTITIONS + 1);

            for (int i = 0; i < READERS; i++) {
                readers.submit(() -> {
                    while (!Thread.currentThread().isInterrupted()) {
                        simulator.readBlock();
                    }
                });
            }

            for (int p = 0; p < PARTITIONS; p++) {
                final int partition = p;
                scheduler.scheduleAtFixedRate(() -> requestStats(factory, cache, clock, partition),
                    0, 100, TimeUnit.MILLISECONDS);
            }

            scheduler.scheduleAtFixedRate(() -> printStats(factory, cache, clock, simulator),
                1, 5, TimeUnit.SECONDS);

            Thread.sleep(30_000);

            scheduler.shutdownNow();
            readers.shutdownNow();
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
            readers.awaitTermination(5, TimeUnit.SECONDS);

            System.out.println("\nDemo complete!");
            printStats(factory, cache, clock, simulator);
        }
    }

    private static void requestStats(StatsCollectorFactory factory, LocalCache cache,
                                     SystemClock clock, int partition) {
        try (SharedCacheHandle<CacheEntryStatsCollector<CacheEntryRoleStats>> guard =
                 factory.getShared(cache, clock, CacheEntryRoleStats.KIND)) {
            CacheEntryRoleStats stats = guard.get().getStats(MAXIMUM_AGE);
            statsRequests.incrementAndGet();
            log.trace("Partition {} got stats from collection {}", partition, stats.getCollectionCount());
        } catch (CacheInsertException e) {
            log.warn("Partition {} could not get cache stats: {}", partition, e.getMessage());
        }
    }

    private static void printStats(StatsCollectorFactory factory, LocalCache cache,
                                   SystemClock clock, CacheLoadSimulator simulator) {
        try (SharedCacheHandle<CacheEntryStatsCollector<CacheEntryRoleStats>> guard =
                 factory.getShared(cache, clock, CacheEntryRoleStats.KIND)) {
            CacheEntryRoleStats stats = guard.get().getStats(MAXIMUM_AGE);
            int requests = statsRequests.get();
            int scans = stats.getCollectionCount();

            System.out.printf("Reads: hits=%d misses=%d rejected=%d | usage %d / %d%n",
                simulator.getHits(), simulator.getMisses(), simulator.getRejected(),
                cache.getUsage(), cache.getCapacity());
            System.out.printf("Stats: %d requests served by %d scans (%.1f requests per scan)%n",
                requests, scans, scans == 0 ? 0.0 : (double) requests / scans);
            System.out.println(stats.format(clock));
            System.out.println();
        } catch (CacheInsertException e) {
            log.warn("Could not get cache stats for printing: {}", e.getMessage());
        }
    }
}
