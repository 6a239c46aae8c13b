package com.example.tieredcache.core;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * One stored value. Entries are never mutated: an overwrite replaces the whole entry.
 */
public final class CacheEntry<V> {

    /** Pass as a ttl to store an entry that never expires. */
    public static final Duration NO_EXPIRY = ChronoUnit.FOREVER.getDuration();

    static final long ETERNAL = Long.MAX_VALUE;

    private final V value;
    private final long storedAt;   // ticker reading at insertion, nanos
    private final long ttlNanos;   // ETERNAL when the entry never expires

    CacheEntry(V value, long storedAt, long ttlNanos) {
        this.value = value;
        this.storedAt = storedAt;
        this.ttlNanos = ttlNanos;
    }

    public V getValue() {
        return value;
    }

    public long getStoredAt() {
        return storedAt;
    }

    public long getTtlNanos() {
        return ttlNanos;
    }

    public boolean isEternal() {
        return ttlNanos == ETERNAL;
    }

    public boolean isLive(long now) {
        return ttlNanos == ETERNAL || now - storedAt < ttlNanos;
    }

    /**
     * Converts a ttl to nanos. {@code null} and durations too large for a long
     * (such as {@link #NO_EXPIRY}) mean the entry never expires.
     */
    static long toNanos(Duration ttl) {
        if (ttl == null) {
            return ETERNAL;
        }
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
        try {
            return ttl.toNanos();
        } catch (ArithmeticException overflow) {
            return ETERNAL;
        }
    }
}
