package com.krishnamouli.cacher.core;

import com.krishnamouli.cacher.config.CacherConfig;
import com.krishnamouli.cacher.core.eviction.EvictionPolicy;
import com.krishnamouli.cacher.core.eviction.EvictionPolicyType;
import com.krishnamouli.cacher.exception.CacheException;
import com.krishnamouli.cacher.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process key/value cache bounded by entry count and per-entry TTL.
 * <p>
 * When a new key arrives at capacity, exactly one entry is evicted by the
 * configured {@link EvictionPolicy}. Expired entries are removed lazily on
 * {@link #get} and periodically by a background {@link ExpirySweeper}.
 * <p>
 * All state sits behind a single read/write lock. {@link #get} takes the
 * write lock because it updates access metadata.
 */
public class Cacher<K, V> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Cacher.class);

    private final EntryTable<K, V> entries;
    private final RecencyIndex<K> recency;
    private final ReadWriteLock lock;
    private final Clock clock;
    private final Random random;
    private final Duration clearingInterval;
    private final MetricsCollector metrics;
    private final ExpirySweeper<K, V> sweeper;

    private int capacity;
    private EvictionPolicy evictionPolicy;

    public Cacher(CacherConfig config) {
        this(config, Clock.systemUTC());
    }

    public Cacher(int capacity, Duration clearingInterval, EvictionPolicyType evictionPolicy) {
        this(new CacherConfig(capacity, clearingInterval, evictionPolicy));
    }

    public Cacher(CacherConfig config, Clock clock) {
        config.validate();

        this.entries = new EntryTable<>();
        this.recency = new RecencyIndex<>();
        this.lock = new ReentrantReadWriteLock();
        this.clock = clock;
        this.random = config.getRandomSeed() != null ? new Random(config.getRandomSeed()) : new Random();
        this.clearingInterval = config.getEffectiveClearingInterval();
        this.metrics = new MetricsCollector(config.isLatencyTrackingEnabled());
        this.capacity = config.getCapacity();
        this.evictionPolicy = config.getEvictionPolicy().createPolicy(random);

        this.sweeper = new ExpirySweeper<>(entries, recency, lock.writeLock(), clock, metrics);
        this.sweeper.start(clearingInterval);

        logger.info("Cacher initialized: capacity={}, policy={}, clearingInterval={}",
                capacity > 0 ? capacity : "unlimited", evictionPolicy.getType(), clearingInterval);
    }

    /**
     * Returns the value for the key and records the access.
     *
     * @throws CacheException NOT_FOUND if the key is absent or has expired
     */
    public V get(K key) throws CacheException {
        long start = System.nanoTime();
        lock.writeLock().lock();
        try {
            CacheEntry<V> entry = entries.lookup(key);
            if (entry == null || sweeper.expireIfElapsed(key, entry)) {
                metrics.recordMiss();
                throw CacheException.notFound(key);
            }

            entries.touch(key, clock.instant());
            recency.moveToFront(key);
            metrics.recordHit();
            return entry.getValue();
        } finally {
            lock.writeLock().unlock();
            metrics.recordOperation(System.nanoTime() - start);
        }
    }

    /**
     * Stores the value, replacing any existing entry for the key.
     * A new key arriving at capacity first evicts one entry.
     *
     * @param ttl time to live after the last access, {@link Duration#ZERO} for no expiry
     */
    public void set(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        checkTTL(ttl);

        long start = System.nanoTime();
        lock.writeLock().lock();
        try {
            boolean replacing = entries.containsKey(key);
            if (!replacing && capacity > 0 && entries.size() >= capacity) {
                evict();
            }

            entries.insert(key, value, ttl, clock.instant());
            recency.pushFront(key);
        } finally {
            lock.writeLock().unlock();
            metrics.recordOperation(System.nanoTime() - start);
        }
    }

    /**
     * @throws CacheException NOT_FOUND if the key is absent
     */
    public void delete(K key) throws CacheException {
        long start = System.nanoTime();
        lock.writeLock().lock();
        try {
            if (entries.remove(key) == null) {
                throw CacheException.notFound(key);
            }
            recency.remove(key);
        } finally {
            lock.writeLock().unlock();
            metrics.recordOperation(System.nanoTime() - start);
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            recency.clear();
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Cache cleared");
    }

    /**
     * @return all live keys, in no particular order
     * @throws CacheException EMPTY_CACHE if the cache holds no entries
     */
    public List<K> keys() throws CacheException {
        lock.readLock().lock();
        try {
            if (entries.isEmpty()) {
                throw CacheException.emptyCache();
            }
            return entries.allKeys();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return all live values, in no particular order; empty for an empty cache
     */
    public List<V> getAll() {
        lock.readLock().lock();
        try {
            return entries.allValues();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the TTL of a live entry. The access clock is not reset.
     *
     * @throws CacheException NOT_FOUND if the key is absent
     */
    public void setTTL(K key, Duration ttl) throws CacheException {
        checkTTL(ttl);
        lock.writeLock().lock();
        try {
            CacheEntry<V> entry = entries.lookup(key);
            if (entry == null) {
                throw CacheException.notFound(key);
            }
            entry.setTTL(ttl);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the configured TTL of the entry
     * @throws CacheException NOT_FOUND if the key is absent
     */
    public Duration getTTL(K key) throws CacheException {
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = entries.lookup(key);
            if (entry == null) {
                throw CacheException.notFound(key);
            }
            return entry.getTTL();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return how many times the entry was stored or read since it was last set
     * @throws CacheException NOT_FOUND if the key is absent
     */
    public long getCounter(K key) throws CacheException {
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = entries.lookup(key);
            if (entry == null) {
                throw CacheException.notFound(key);
            }
            return entry.getAccessCount();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Changes the maximum number of entries, 0 for unlimited. Entries above a
     * lowered capacity are not evicted until the next {@link #set}.
     *
     * @throws CacheException INVALID_CAPACITY if the capacity is negative
     */
    public void setCapacity(int newCapacity) throws CacheException {
        if (newCapacity < 0) {
            throw CacheException.invalidCapacity(newCapacity);
        }
        lock.writeLock().lock();
        try {
            capacity = newCapacity;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Capacity changed: {}", newCapacity > 0 ? newCapacity : "unlimited");
    }

    public int getCapacity() {
        lock.readLock().lock();
        try {
            return capacity;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param code policy code, see {@link EvictionPolicyType#getCode()}
     * @throws CacheException INVALID_POLICY if the code names no policy
     */
    public void setEvictionPolicy(int code) throws CacheException {
        setEvictionPolicy(EvictionPolicyType.fromCode(code));
    }

    /**
     * Switches the eviction policy. The recency order is kept as is and the
     * new policy applies from the next eviction.
     *
     * @throws CacheException INVALID_POLICY if the type is null
     */
    public void setEvictionPolicy(EvictionPolicyType type) throws CacheException {
        if (type == null) {
            throw CacheException.invalidPolicy(null);
        }
        lock.writeLock().lock();
        try {
            evictionPolicy = type.createPolicy(random);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Eviction policy changed: {}", type);
    }

    public EvictionPolicyType getEvictionPolicy() {
        lock.readLock().lock();
        try {
            return evictionPolicy.getType();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Duration getClearingInterval() {
        return clearingInterval;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats<K, V> stats() {
        lock.readLock().lock();
        try {
            List<CacheStats.EntrySnapshot<K, V>> listing = new ArrayList<>(entries.size());
            entries.forEach((key, entry) -> listing.add(new CacheStats.EntrySnapshot<>(
                    key, entry.getValue(), entry.getTTL(), entry.getAccessCount(), entry.getLastAccessTime())));

            return new CacheStats<>(evictionPolicy.getType(), capacity, clearingInterval, entries.size(),
                    metrics.getHitCount(), metrics.getMissCount(),
                    metrics.getEvictionCount(), metrics.getExpirationCount(), listing);
        } finally {
            lock.readLock().unlock();
        }
    }

    public MetricsCollector.MetricsSnapshot getMetrics() {
        return metrics.getSnapshot(size());
    }

    /**
     * Runs one expiry sweep on the calling thread.
     *
     * @return number of expired entries removed
     */
    public int purgeExpired() {
        return sweeper.sweep();
    }

    /**
     * Stops the background sweep. The cache stays usable; expired entries are
     * still dropped when read.
     */
    @Override
    public void close() {
        if (sweeper.shutdown()) {
            logger.info("Cacher closed");
        }
    }

    // Table keys and recency keys must always be the same set
    boolean isConsistent() {
        lock.readLock().lock();
        try {
            List<K> ordered = recency.keys();
            return ordered.size() == entries.size()
                    && new HashSet<>(ordered).equals(new HashSet<>(entries.allKeys()));
        } finally {
            lock.readLock().unlock();
        }
    }

    List<K> recencyOrder() {
        lock.readLock().lock();
        try {
            return recency.keys();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void evict() {
        K victimKey = evictionPolicy.selectVictim(entries, recency);
        if (victimKey != null) {
            entries.remove(victimKey);
            recency.remove(victimKey);
            metrics.recordEviction();
            logger.debug("Evicted key: {} ({})", victimKey, evictionPolicy.getType());
        }
    }

    private static void checkTTL(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl cannot be negative: " + ttl);
        }
    }
}
