package com.krishnamouli.cacher.core.eviction;

import com.krishnamouli.cacher.core.EntryTable;
import com.krishnamouli.cacher.core.RecencyIndex;

/**
 * Strategy interface for cache eviction policies.
 * Implementations only select; the caller removes the victim.
 */
public interface EvictionPolicy {

    /**
     * Select an entry to evict.
     *
     * @param entries Current entries in the cache
     * @param recency Live keys ordered most-recent-first
     * @return Key of entry to evict, or null if the cache is empty
     */
    <K, V> K selectVictim(EntryTable<K, V> entries, RecencyIndex<K> recency);

    /**
     * The variant this policy implements.
     */
    EvictionPolicyType getType();
}
