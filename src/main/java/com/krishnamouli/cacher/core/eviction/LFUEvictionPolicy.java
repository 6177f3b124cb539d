package com.krishnamouli.cacher.core.eviction;

import com.krishnamouli.cacher.core.CacheEntry;
import com.krishnamouli.cacher.core.EntryTable;
import com.krishnamouli.cacher.core.RecencyIndex;

/**
 * Least Frequently Used (LFU) eviction policy.
 * Evicts the entry with the lowest access count. On a tie the first key
 * met while scanning the table wins.
 */
public class LFUEvictionPolicy implements EvictionPolicy {

    @Override
    public <K, V> K selectVictim(EntryTable<K, V> entries, RecencyIndex<K> recency) {
        if (entries.isEmpty()) {
            return null;
        }

        K victimKey = null;
        long lowestCount = Long.MAX_VALUE;

        for (int i = 0; i < entries.size(); i++) {
            K key = entries.keyAt(i);
            CacheEntry<V> entry = entries.lookup(key);
            long count = entry.getAccessCount();

            // strict comparison keeps the first minimum
            if (count < lowestCount) {
                lowestCount = count;
                victimKey = key;
            }
        }

        return victimKey;
    }

    @Override
    public EvictionPolicyType getType() {
        return EvictionPolicyType.LFU;
    }
}
