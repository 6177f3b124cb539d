package com.krishnamouli.cacher.config;

import java.time.Duration;

/**
 * Centralized constants for Cacher.
 * Externalizes the defaults and tuneable limits used by the engine.
 */
public class CacheConfiguration {

    // Capacity
    /**
     * Capacity value meaning "no limit on the number of entries".
     */
    public static final int UNLIMITED_CAPACITY = 0;

    // Expiry sweep
    /**
     * Sweep period used when the configured clearing interval is zero (100s).
     */
    public static final Duration DEFAULT_CLEARING_INTERVAL = Duration.ofSeconds(100);

    /**
     * Longest sweep period actually scheduled (100 years). Longer intervals
     * are capped so the period still fits in nanoseconds.
     */
    public static final Duration MAX_SWEEP_PERIOD = Duration.ofDays(36_500);

    /**
     * Maximum time to wait for an in-flight sweep when the cache is closed.
     */
    public static final long SWEEPER_SHUTDOWN_TIMEOUT_SECONDS = 5;

    /**
     * Name of the background sweep thread.
     */
    public static final String SWEEPER_THREAD_NAME = "cacher-sweeper";

    // Metrics
    /**
     * Highest latency the histogram tracks, in microseconds (1 hour).
     */
    public static final long MAX_TRACKED_LATENCY_MICROS = 3_600_000_000L;

    /**
     * Significant value digits kept by the latency histogram.
     */
    public static final int LATENCY_SIGNIFICANT_DIGITS = 3;

    // Private constructor to prevent instantiation
    private CacheConfiguration() {
        throw new AssertionError("Configuration class should not be instantiated");
    }

    /**
     * Validates configuration values on startup.
     * Throws IllegalArgumentException if configuration is invalid.
     */
    public static void validate() {
        if (DEFAULT_CLEARING_INTERVAL.isNegative() || DEFAULT_CLEARING_INTERVAL.isZero()) {
            throw new IllegalArgumentException("DEFAULT_CLEARING_INTERVAL must be positive");
        }
        if (MAX_SWEEP_PERIOD.compareTo(DEFAULT_CLEARING_INTERVAL) < 0) {
            throw new IllegalArgumentException("MAX_SWEEP_PERIOD must not be shorter than DEFAULT_CLEARING_INTERVAL");
        }
        if (SWEEPER_SHUTDOWN_TIMEOUT_SECONDS <= 0) {
            throw new IllegalArgumentException("SWEEPER_SHUTDOWN_TIMEOUT_SECONDS must be positive");
        }
        if (LATENCY_SIGNIFICANT_DIGITS < 0 || LATENCY_SIGNIFICANT_DIGITS > 5) {
            throw new IllegalArgumentException("LATENCY_SIGNIFICANT_DIGITS must be in [0, 5]");
        }
    }
}
