package com.krishnamouli.cacher.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Single cache entry with the metadata used for expiry and eviction.
 * Not thread-safe on its own: every access goes through the owning
 * {@link Cacher}'s lock.
 */
public class CacheEntry<V> {
    private final V value;
    private Duration ttl;
    private long accessCount;
    private Instant lastAccessTime;

    public CacheEntry(V value, Duration ttl, Instant now) {
        this.value = value;
        this.ttl = ttl;
        this.accessCount = 1;
        this.lastAccessTime = now;
    }

    public V getValue() {
        return value;
    }

    public void recordAccess(Instant now) {
        lastAccessTime = now;
        accessCount++;
    }

    /**
     * An entry with a zero TTL never expires. Otherwise it expires once
     * more than {@code ttl} has passed since {@code lastAccessTime}. Compares
     * elapsed time against the TTL so TTLs past {@link Instant#MAX} cannot overflow.
     */
    public boolean isExpired(Instant now) {
        return !ttl.isZero() && Duration.between(lastAccessTime, now).compareTo(ttl) > 0;
    }

    // Replaces the TTL without resetting the access clock
    public void setTTL(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getTTL() {
        return ttl;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public Instant getLastAccessTime() {
        return lastAccessTime;
    }
}
