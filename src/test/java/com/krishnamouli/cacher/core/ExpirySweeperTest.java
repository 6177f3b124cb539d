package com.krishnamouli.cacher.core;

import com.krishnamouli.cacher.config.CacherConfig;
import com.krishnamouli.cacher.core.eviction.EvictionPolicyType;
import com.krishnamouli.cacher.monitoring.MetricsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class ExpirySweeperTest {

    private MutableClock clock;
    private EntryTable<String, String> entries;
    private RecencyIndex<String> recency;
    private MetricsCollector metrics;
    private ExpirySweeper<String, String> sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        entries = new EntryTable<>();
        recency = new RecencyIndex<>();
        metrics = new MetricsCollector();
        sweeper = new ExpirySweeper<>(entries, recency, new ReentrantLock(), clock, metrics);
    }

    @Test
    void testSweepRemovesOnlyExpiredEntries() {
        put("short", Duration.ofSeconds(1));
        put("long", Duration.ofSeconds(60));
        put("forever", Duration.ZERO);

        clock.advance(Duration.ofSeconds(2));

        assertEquals(1, sweeper.sweep());
        assertNull(entries.lookup("short"));
        assertFalse(recency.contains("short"));
        assertEquals(List.of("forever", "long"), recency.keys());
        assertEquals(1, metrics.getExpirationCount());
    }

    @Test
    void testSweepIsIdempotent() {
        put("short", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        assertEquals(1, sweeper.sweep());
        assertEquals(0, sweeper.sweep());
    }

    @Test
    void testExpireIfElapsed() {
        put("key", Duration.ofSeconds(1));
        CacheEntry<String> entry = entries.lookup("key");

        assertFalse(sweeper.expireIfElapsed("key", entry));
        assertNotNull(entries.lookup("key"));

        clock.advance(Duration.ofSeconds(2));

        assertTrue(sweeper.expireIfElapsed("key", entry));
        assertNull(entries.lookup("key"));
        assertEquals(0, recency.size());
    }

    @Test
    void testSweepWithMaximumTTL() {
        put("forever", Duration.ofSeconds(Long.MAX_VALUE));
        put("short", Duration.ofSeconds(1));

        clock.advance(Duration.ofDays(3650));

        assertEquals(1, sweeper.sweep());
        assertEquals(List.of("forever"), recency.keys());
        assertFalse(sweeper.expireIfElapsed("forever", entries.lookup("forever")));
    }

    @Test
    void testStartWithMaximumInterval() {
        assertDoesNotThrow(() -> sweeper.start(Duration.ofSeconds(Long.MAX_VALUE)));
        assertTrue(sweeper.isRunning());
        assertTrue(sweeper.shutdown());
    }

    @Test
    void testCacheWithMaximumClearingInterval() {
        CacherConfig config = new CacherConfig(10, Duration.ofSeconds(Long.MAX_VALUE), EvictionPolicyType.LRU);
        Cacher<String, String> cache = assertDoesNotThrow(() -> new Cacher<String, String>(config, clock));
        try {
            assertEquals(Duration.ofSeconds(Long.MAX_VALUE), cache.getClearingInterval());
        } finally {
            cache.close();
        }
    }

    @Test
    void testShutdownIsIdempotent() {
        sweeper.start(Duration.ofMillis(10));
        assertTrue(sweeper.isRunning());

        assertTrue(sweeper.shutdown());
        assertFalse(sweeper.shutdown());

        assertFalse(sweeper.isRunning());
    }

    @Test
    @Timeout(10)
    void testConcurrentShutdownStopsOnce() throws Exception {
        sweeper.start(Duration.ofMillis(10));
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    startGate.await();
                    return sweeper.shutdown();
                }));
            }
            startGate.countDown();

            int stoppedBy = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    stoppedBy++;
                }
            }
            assertEquals(1, stoppedBy);
            assertFalse(sweeper.isRunning());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @Timeout(10)
    void testBackgroundSweepRemovesExpiredEntries() throws InterruptedException {
        CacherConfig config = new CacherConfig(10, Duration.ofMillis(20), EvictionPolicyType.LRU);
        Cacher<String, String> cache = new Cacher<>(config);
        try {
            cache.set("exp_key", "exp_value", Duration.ofMillis(20));
            cache.set("keep", "value", Duration.ZERO);

            waitForSize(cache, 1);

            assertEquals(List.of("keep"), cache.recencyOrder());
            assertTrue(cache.isConsistent());
        } finally {
            cache.close();
        }
    }

    @Test
    @Timeout(10)
    void testNoSweepAfterClose() throws InterruptedException {
        CacherConfig config = new CacherConfig(10, Duration.ofMillis(20), EvictionPolicyType.LRU);
        Cacher<String, String> cache = new Cacher<>(config);

        cache.close();
        cache.set("exp_key", "exp_value", Duration.ofMillis(10));
        Thread.sleep(200);

        assertEquals(1, cache.size(), "Closed cache must not sweep in the background");
    }

    private void put(String key, Duration ttl) {
        entries.insert(key, "value-" + key, ttl, clock.instant());
        recency.pushFront(key);
    }

    private static void waitForSize(Cacher<?, ?> cache, int expected) throws InterruptedException {
        while (cache.size() != expected) {
            Thread.sleep(10);
        }
    }
}
