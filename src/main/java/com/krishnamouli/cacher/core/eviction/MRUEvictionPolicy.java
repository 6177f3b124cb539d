package com.krishnamouli.cacher.core.eviction;

import com.krishnamouli.cacher.core.EntryTable;
import com.krishnamouli.cacher.core.RecencyIndex;

/**
 * Most Recently Used (MRU) eviction policy.
 * Evicts the key at the front of the recency index, which suits cyclic
 * scans where the newest entry is the least likely to be read again soon.
 */
public class MRUEvictionPolicy implements EvictionPolicy {

    @Override
    public <K, V> K selectVictim(EntryTable<K, V> entries, RecencyIndex<K> recency) {
        return recency.front();
    }

    @Override
    public EvictionPolicyType getType() {
        return EvictionPolicyType.MRU;
    }
}
