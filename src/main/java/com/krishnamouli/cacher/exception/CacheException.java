package com.krishnamouli.cacher.exception;

/**
 * Checked exception for every recoverable cache failure.
 * The {@link ErrorType} tells callers which contract was violated; an expired
 * key and an absent key are both reported as {@link ErrorType#NOT_FOUND}.
 */
public class CacheException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorType type;

    public enum ErrorType {
        /** Key absent or expired at read time */
        NOT_FOUND("Key not found"),

        /** Key listing requested on a cache with no entries */
        EMPTY_CACHE("Cache is empty"),

        /** Negative capacity */
        INVALID_CAPACITY("Invalid capacity"),

        /** Eviction policy outside the recognized variants */
        INVALID_POLICY("Invalid eviction policy");

        private final String description;

        ErrorType(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    public CacheException(ErrorType type, String detail) {
        super(type.getDescription() + ": " + detail);
        this.type = type;
    }

    public static CacheException notFound(Object key) {
        return new CacheException(ErrorType.NOT_FOUND, String.valueOf(key));
    }

    public static CacheException emptyCache() {
        return new CacheException(ErrorType.EMPTY_CACHE, "no keys found");
    }

    public static CacheException invalidCapacity(int capacity) {
        return new CacheException(ErrorType.INVALID_CAPACITY,
                "capacity cannot be negative: " + capacity);
    }

    public static CacheException invalidPolicy(Object policy) {
        return new CacheException(ErrorType.INVALID_POLICY,
                policy + " (must be one of LRU, MRU, LFU, RANDOM)");
    }

    public ErrorType getType() {
        return type;
    }
}
