package com.krishnamouli.cacher.config;

import com.krishnamouli.cacher.core.eviction.EvictionPolicyType;

import java.time.Duration;

/**
 * Per-instance configuration for a Cacher.
 */
public class CacherConfig {

    // Maximum number of entries, 0 = unlimited
    private int capacity = CacheConfiguration.UNLIMITED_CAPACITY;

    // Expiry sweep period, zero = default
    private Duration clearingInterval = Duration.ZERO;

    private EvictionPolicyType evictionPolicy = EvictionPolicyType.LRU;

    // Seed for RANDOM eviction, null = unseeded
    private Long randomSeed;

    // Latency histogram for getMetrics(); hit/miss/eviction counters are always kept
    private boolean latencyTrackingEnabled = true;

    public CacherConfig() {
    }

    public CacherConfig(int capacity, Duration clearingInterval, EvictionPolicyType evictionPolicy) {
        this.capacity = capacity;
        this.clearingInterval = clearingInterval;
        this.evictionPolicy = evictionPolicy;
    }

    /**
     * Throws IllegalArgumentException if the configuration cannot build a cache,
     * including when the shared {@link CacheConfiguration} constants are invalid.
     */
    public void validate() {
        CacheConfiguration.validate();
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity cannot be negative: " + capacity);
        }
        if (clearingInterval == null || clearingInterval.isNegative()) {
            throw new IllegalArgumentException("clearingInterval must be zero or positive: " + clearingInterval);
        }
        if (evictionPolicy == null) {
            throw new IllegalArgumentException("evictionPolicy is required");
        }
    }

    /**
     * The sweep period actually used: the configured interval, or
     * {@link CacheConfiguration#DEFAULT_CLEARING_INTERVAL} when it is zero.
     */
    public Duration getEffectiveClearingInterval() {
        if (clearingInterval == null || clearingInterval.isZero()) {
            return CacheConfiguration.DEFAULT_CLEARING_INTERVAL;
        }
        return clearingInterval;
    }

    // Getters and setters
    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public Duration getClearingInterval() {
        return clearingInterval;
    }

    public void setClearingInterval(Duration clearingInterval) {
        this.clearingInterval = clearingInterval;
    }

    public EvictionPolicyType getEvictionPolicy() {
        return evictionPolicy;
    }

    public void setEvictionPolicy(EvictionPolicyType evictionPolicy) {
        this.evictionPolicy = evictionPolicy;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public boolean isLatencyTrackingEnabled() {
        return latencyTrackingEnabled;
    }

    public void setLatencyTrackingEnabled(boolean latencyTrackingEnabled) {
        this.latencyTrackingEnabled = latencyTrackingEnabled;
    }

    @Override
    public String toString() {
        return String.format(
                "CacherConfig{capacity=%d, clearingInterval=%s, eviction=%s, randomSeed=%s, latencyTracking=%s}",
                capacity, clearingInterval, evictionPolicy, randomSeed, latencyTrackingEnabled);
    }
}
