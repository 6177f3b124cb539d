package com.krishnamouli.cacher.core;

import com.krishnamouli.cacher.core.eviction.EvictionPolicyType;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Point-in-time diagnostic snapshot of a {@link Cacher}.
 * Taking a snapshot never mutates the cache.
 */
public class CacheStats<K, V> {
    // Largest whole-second count whose nanosecond value fits in a long
    private static final long MAX_NANOS_SECONDS = Long.MAX_VALUE / 1_000_000_000L;

    public final EvictionPolicyType evictionPolicy;
    public final int capacity;
    public final Duration clearingInterval;
    public final int size;
    public final long hits;
    public final long misses;
    public final long evictions;
    public final long expirations;
    public final List<EntrySnapshot<K, V>> entries;

    public CacheStats(EvictionPolicyType evictionPolicy, int capacity, Duration clearingInterval,
            int size, long hits, long misses, long evictions, long expirations,
            List<EntrySnapshot<K, V>> entries) {
        this.evictionPolicy = evictionPolicy;
        this.capacity = capacity;
        this.clearingInterval = clearingInterval;
        this.size = size;
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.expirations = expirations;
        this.entries = Collections.unmodifiableList(entries);
    }

    public String getPolicyName() {
        return evictionPolicy.name();
    }

    /**
     * @return the capacity as text, or "unlimited" when capacity is 0
     */
    public String getCapacityLabel() {
        return capacity > 0 ? Integer.toString(capacity) : "unlimited";
    }

    /**
     * Percentage of capacity in use; 0 for an unbounded cache.
     */
    public double getOccupancy() {
        return capacity > 0 ? (size * 100.0) / capacity : 0.0;
    }

    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    /**
     * Renders the human readable report.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("STATS\n");
        sb.append("Eviction Policy: ").append(getPolicyName()).append('\n');
        sb.append("Capacity: ").append(getCapacityLabel()).append('\n');
        sb.append("Clearing Interval: ").append(formatDuration(clearingInterval)).append('\n');
        sb.append("Items: ").append(size).append('\n');
        sb.append(String.format(Locale.ROOT, "Occupancy: %.2f%%\n", getOccupancy()));
        sb.append("Cache:\n");
        for (EntrySnapshot<K, V> entry : entries) {
            sb.append(String.format(Locale.ROOT, "  Key: %s Value: %s TTL: %s Counter: %d Last Used: %s\n",
                    entry.key, entry.value, formatDuration(entry.ttl), entry.counter, entry.lastAccessTime));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        int nanos = duration.getNano();
        if (nanos == 0) {
            return seconds + "s";
        }
        // toMillis and toNanos overflow for very long durations
        if (seconds >= MAX_NANOS_SECONDS) {
            return seconds + "s";
        }
        if (nanos % 1_000_000 == 0) {
            return duration.toMillis() + "ms";
        }
        return duration.toNanos() + "ns";
    }

    public static class EntrySnapshot<K, V> {
        public final K key;
        public final V value;
        public final Duration ttl;
        public final long counter;
        public final Instant lastAccessTime;

        public EntrySnapshot(K key, V value, Duration ttl, long counter, Instant lastAccessTime) {
            this.key = key;
            this.value = value;
            this.ttl = ttl;
            this.counter = counter;
            this.lastAccessTime = lastAccessTime;
        }
    }
}
