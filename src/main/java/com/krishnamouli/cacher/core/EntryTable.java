package com.krishnamouli.cacher.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Authoritative mapping from key to {@link CacheEntry}.
 * Keys are also kept in a dense array so a key can be picked by position
 * in O(1); removal swaps the last key into the freed slot.
 * Holds no policy or expiry logic and is not thread-safe.
 */
public class EntryTable<K, V> {

    private final Map<K, Slot<V>> slots;
    private final List<K> keys;

    public EntryTable() {
        this.slots = new HashMap<>();
        this.keys = new ArrayList<>();
    }

    /**
     * Stores a fresh entry (counter 1, last access {@code now}) for the key,
     * replacing any existing one.
     *
     * @return the replaced entry, or null if the key was not present
     */
    public CacheEntry<V> insert(K key, V value, Duration ttl, Instant now) {
        CacheEntry<V> entry = new CacheEntry<>(value, ttl, now);
        Slot<V> slot = slots.get(key);
        if (slot != null) {
            CacheEntry<V> previous = slot.entry;
            slot.entry = entry;
            return previous;
        }
        slots.put(key, new Slot<>(entry, keys.size()));
        keys.add(key);
        return null;
    }

    /**
     * Returns the entry for the key, or null. Does not check expiry.
     */
    public CacheEntry<V> lookup(K key) {
        Slot<V> slot = slots.get(key);
        return slot != null ? slot.entry : null;
    }

    public boolean touch(K key, Instant now) {
        Slot<V> slot = slots.get(key);
        if (slot == null) {
            return false;
        }
        slot.entry.recordAccess(now);
        return true;
    }

    public CacheEntry<V> remove(K key) {
        Slot<V> slot = slots.remove(key);
        if (slot == null) {
            return null;
        }
        int last = keys.size() - 1;
        if (slot.position != last) {
            K moved = keys.get(last);
            keys.set(slot.position, moved);
            slots.get(moved).position = slot.position;
        }
        keys.remove(last);
        return slot.entry;
    }

    public void clear() {
        slots.clear();
        keys.clear();
    }

    public boolean containsKey(K key) {
        return slots.containsKey(key);
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * Key at the given position of the internal key array.
     * Positions are stable only until the next removal.
     */
    public K keyAt(int index) {
        return keys.get(index);
    }

    public List<K> allKeys() {
        return new ArrayList<>(keys);
    }

    public List<V> allValues() {
        List<V> values = new ArrayList<>(keys.size());
        for (K key : keys) {
            values.add(slots.get(key).entry.getValue());
        }
        return values;
    }

    // Visits entries in key-array order
    public void forEach(BiConsumer<? super K, ? super CacheEntry<V>> action) {
        for (K key : keys) {
            action.accept(key, slots.get(key).entry);
        }
    }

    private static final class Slot<V> {
        private CacheEntry<V> entry;
        private int position;

        private Slot(CacheEntry<V> entry, int position) {
            this.entry = entry;
            this.position = position;
        }
    }
}
