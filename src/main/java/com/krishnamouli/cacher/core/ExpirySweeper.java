package com.krishnamouli.cacher.core;

import com.krishnamouli.cacher.config.CacheConfiguration;
import com.krishnamouli.cacher.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

/**
 * Removes expired entries, periodically on a background thread and lazily
 * for single keys on read.
 * Works on the owning cache's table, index and lock; it keeps no copy of
 * the cached state.
 */
public class ExpirySweeper<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(ExpirySweeper.class);

    private final EntryTable<K, V> entries;
    private final RecencyIndex<K> recency;
    private final Lock lock;
    private final Clock clock;
    private final MetricsCollector metrics;
    private final ScheduledExecutorService sweepExecutor;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ExpirySweeper(EntryTable<K, V> entries, RecencyIndex<K> recency, Lock lock,
            Clock clock, MetricsCollector metrics) {
        this.entries = entries;
        this.recency = recency;
        this.lock = lock;
        this.clock = clock;
        this.metrics = metrics;
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, CacheConfiguration.SWEEPER_THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedules the periodic sweep. Intervals longer than
     * {@link CacheConfiguration#MAX_SWEEP_PERIOD} are capped to it.
     */
    public void start(Duration interval) {
        Duration period = interval.compareTo(CacheConfiguration.MAX_SWEEP_PERIOD) > 0
                ? CacheConfiguration.MAX_SWEEP_PERIOD
                : interval;
        long periodNanos = period.toNanos();
        sweepExecutor.scheduleAtFixedRate(this::runScheduledSweep, periodNanos, periodNanos,
                TimeUnit.NANOSECONDS);
        logger.debug("Expiry sweeper started: interval={}", interval);
    }

    /**
     * Scans every entry and removes the expired ones.
     *
     * @return number of entries removed
     */
    public int sweep() {
        lock.lock();
        try {
            return removeExpired(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the key if its entry has expired. The caller must hold the
     * cache's write lock.
     *
     * @return true if the entry was expired and has been removed
     */
    public boolean expireIfElapsed(K key, CacheEntry<V> entry) {
        if (!entry.isExpired(clock.instant())) {
            return false;
        }
        entries.remove(key);
        recency.remove(key);
        metrics.recordExpirations(1);
        logger.debug("Expired key: {}", key);
        return true;
    }

    /**
     * Stops the periodic sweep. No sweep starts once this is called; an
     * in-flight sweep is given time to finish before this returns.
     * Only the first of any number of concurrent calls does the work.
     *
     * @return true if this call stopped the sweeper, false if it was already stopped
     */
    public boolean shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return false;
        }
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(CacheConfiguration.SWEEPER_SHUTDOWN_TIMEOUT_SECONDS,
                    TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.debug("Expiry sweeper stopped");
        return true;
    }

    public boolean isRunning() {
        return !stopped.get();
    }

    private void runScheduledSweep() {
        if (stopped.get()) {
            return;
        }
        try {
            int cleaned;
            lock.lock();
            try {
                if (stopped.get()) {
                    return;
                }
                cleaned = removeExpired(clock.instant());
            } finally {
                lock.unlock();
            }
            if (cleaned > 0) {
                logger.debug("Cleaned up {} expired entries", cleaned);
            }
        } catch (RuntimeException e) {
            logger.error("Expiry sweep failed", e);
        }
    }

    private int removeExpired(Instant now) {
        List<K> expired = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (entry.isExpired(now)) {
                expired.add(key);
            }
        });
        for (K key : expired) {
            entries.remove(key);
            recency.remove(key);
        }
        if (!expired.isEmpty()) {
            metrics.recordExpirations(expired.size());
        }
        return expired.size();
    }
}
