package com.krishnamouli.cacher.core.eviction;

import com.krishnamouli.cacher.exception.CacheException;

import java.util.Locale;
import java.util.Random;

/**
 * The recognized eviction policies, with stable integer codes.
 */
public enum EvictionPolicyType {
    /** Least Recently Used */
    LRU(0),
    /** Most Recently Used */
    MRU(1),
    /** Least Frequently Used */
    LFU(2),
    /** Uniform random choice */
    RANDOM(3);

    private final int code;

    EvictionPolicyType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static EvictionPolicyType fromCode(int code) throws CacheException {
        for (EvictionPolicyType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw CacheException.invalidPolicy(code);
    }

    public static EvictionPolicyType fromName(String name) throws CacheException {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (EvictionPolicyType type : values()) {
                if (type.name().equals(normalized)) {
                    return type;
                }
            }
        }
        throw CacheException.invalidPolicy(name);
    }

    /**
     * Create the policy for this variant.
     *
     * @param random source of randomness, only used by {@link #RANDOM}
     */
    public EvictionPolicy createPolicy(Random random) {
        switch (this) {
            case MRU:
                return new MRUEvictionPolicy();
            case LFU:
                return new LFUEvictionPolicy();
            case RANDOM:
                return new RandomEvictionPolicy(random);
            case LRU:
            default:
                return new LRUEvictionPolicy();
        }
    }
}
