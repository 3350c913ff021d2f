package com.swingtrader.common.cache;

/**
 * Key/value store with per-entry expiry, shared by the execution engine and the
 * data collection loop. Safe for concurrent use.
 */
public interface ResultCache {

    /**
     * Returns the live value stored under {@code key}, or {@code null} if absent or expired.
     * An expired entry is evicted as a side-effect.
     */
    Object get(String key);

    /** Stores {@code value}, replacing any prior entry and resetting its expiry. */
    void set(String key, Object value);

    void clear();

    int size();
}
