package com.krishnamouli.cacher.core.eviction;

import com.krishnamouli.cacher.core.EntryTable;
import com.krishnamouli.cacher.core.RecencyIndex;

/**
 * Least Recently Used (LRU) eviction policy.
 * Evicts the key at the back of the recency index.
 */
public class LRUEvictionPolicy implements EvictionPolicy {

    @Override
    public <K, V> K selectVictim(EntryTable<K, V> entries, RecencyIndex<K> recency) {
        return recency.back();
    }

    @Override
    public EvictionPolicyType getType() {
        return EvictionPolicyType.LRU;
    }
}
