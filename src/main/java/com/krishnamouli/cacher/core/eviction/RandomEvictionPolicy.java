package com.krishnamouli.cacher.core.eviction;

import com.krishnamouli.cacher.core.EntryTable;
import com.krishnamouli.cacher.core.RecencyIndex;

import java.util.Random;

/**
 * Random eviction policy.
 * Picks a live key uniformly at random. Seed the {@link Random} for
 * reproducible eviction sequences.
 */
public class RandomEvictionPolicy implements EvictionPolicy {

    private final Random random;

    public RandomEvictionPolicy() {
        this(new Random());
    }

    public RandomEvictionPolicy(Random random) {
        this.random = random;
    }

    @Override
    public <K, V> K selectVictim(EntryTable<K, V> entries, RecencyIndex<K> recency) {
        if (entries.isEmpty()) {
            return null;
        }
        return entries.keyAt(random.nextInt(entries.size()));
    }

    @Override
    public EvictionPolicyType getType() {
        return EvictionPolicyType.RANDOM;
    }
}
