package com.krishnamouli.cacher.monitoring;

import com.krishnamouli.cacher.config.CacheConfiguration;
import org.HdrHistogram.ConcurrentHistogram;
import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and latency tracking for cache operations.
 * Uses HdrHistogram for accurate latency percentiles. With latency tracking
 * off no histogram is allocated and the snapshot percentiles read 0; the
 * counters are kept either way.
 */
public class MetricsCollector {
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    // null when latency tracking is off
    private final Histogram latencyHistogram;
    private final AtomicLong totalOperations;
    private final AtomicLong hitCount;
    private final AtomicLong missCount;
    private final AtomicLong evictionCount;
    private final AtomicLong expirationCount;

    public MetricsCollector() {
        this(true);
    }

    public MetricsCollector(boolean latencyEnabled) {
        this.latencyHistogram = latencyEnabled
                ? new ConcurrentHistogram(CacheConfiguration.MAX_TRACKED_LATENCY_MICROS,
                        CacheConfiguration.LATENCY_SIGNIFICANT_DIGITS)
                : null;
        this.totalOperations = new AtomicLong(0);
        this.hitCount = new AtomicLong(0);
        this.missCount = new AtomicLong(0);
        this.evictionCount = new AtomicLong(0);
        this.expirationCount = new AtomicLong(0);
    }

    public void recordOperation(long latencyNanos) {
        totalOperations.incrementAndGet();
        if (latencyHistogram == null) {
            return;
        }
        try {
            latencyHistogram.recordValue(latencyNanos / 1000); // Convert to microseconds
        } catch (ArrayIndexOutOfBoundsException e) {
            logger.warn("Latency value out of bounds: {}ns", latencyNanos);
        }
    }

    public void recordHit() {
        hitCount.incrementAndGet();
    }

    public void recordMiss() {
        missCount.incrementAndGet();
    }

    public void recordEviction() {
        evictionCount.incrementAndGet();
    }

    public void recordExpirations(int count) {
        expirationCount.addAndGet(count);
    }

    public long getHitCount() {
        return hitCount.get();
    }

    public long getMissCount() {
        return missCount.get();
    }

    public long getEvictionCount() {
        return evictionCount.get();
    }

    public long getExpirationCount() {
        return expirationCount.get();
    }

    /**
     * @param size current number of entries in the cache
     */
    public MetricsSnapshot getSnapshot(int size) {
        long hits = hitCount.get();
        long misses = missCount.get();
        long total = hits + misses;

        return new MetricsSnapshot(
                hits,
                misses,
                total == 0 ? 0.0 : (double) hits / total,
                evictionCount.get(),
                expirationCount.get(),
                size,
                percentileMillis(50.0),
                percentileMillis(95.0),
                percentileMillis(99.0),
                totalOperations.get());
    }

    public boolean isLatencyEnabled() {
        return latencyHistogram != null;
    }

    public void reset() {
        if (latencyHistogram != null) {
            latencyHistogram.reset();
        }
        totalOperations.set(0);
        hitCount.set(0);
        missCount.set(0);
        evictionCount.set(0);
        expirationCount.set(0);
    }

    private double percentileMillis(double percentile) {
        if (latencyHistogram == null) {
            return 0.0;
        }
        return latencyHistogram.getValueAtPercentile(percentile) / 1000.0;
    }

    public static class MetricsSnapshot {
        public final long hits;
        public final long misses;
        public final double hitRate;
        public final long evictions;
        public final long expirations;
        public final int size;
        public final double p50LatencyMs;
        public final double p95LatencyMs;
        public final double p99LatencyMs;
        public final long totalOperations;

        public MetricsSnapshot(
                long hits, long misses, double hitRate, long evictions,
                long expirations, int size,
                double p50LatencyMs, double p95LatencyMs, double p99LatencyMs,
                long totalOperations) {

            this.hits = hits;
            this.misses = misses;
            this.hitRate = hitRate;
            this.evictions = evictions;
            this.expirations = expirations;
            this.size = size;
            this.p50LatencyMs = p50LatencyMs;
            this.p95LatencyMs = p95LatencyMs;
            this.p99LatencyMs = p99LatencyMs;
            this.totalOperations = totalOperations;
        }
    }
}
