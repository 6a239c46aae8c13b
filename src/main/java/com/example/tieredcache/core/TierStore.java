package com.example.tieredcache.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded LRU map with per-entry time-to-live for a single tier.
 *
 * <p>Recency is kept by an access-ordered {@link LinkedHashMap}: the head is the least
 * recently used key and the tail the most recently used one. Expiry is lazy. A stale entry
 * is dropped only when its key is read, or when it reaches the head and gets evicted.
 * All operations run under one lock, so the expiry check, removal and promotion in
 * {@link #get(String)} are atomic with respect to writers on the same tier.
 */
public class TierStore<V> {

    private final ReentrantLock lock = new ReentrantLock();

    private final LinkedHashMap<String, CacheEntry<V>> entries =
        new LinkedHashMap<>(16, 0.75f, true);

    private final int maxSize;
    private final long defaultTtlNanos;
    private final Ticker ticker;

    public TierStore(int maxSize, Duration defaultTtl) {
        this(maxSize, defaultTtl, Ticker.system());
    }

    public TierStore(int maxSize, Duration defaultTtl, Ticker ticker) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.defaultTtlNanos = CacheEntry.toNanos(defaultTtl);
        this.ticker = Objects.requireNonNull(ticker, "ticker");
    }

    public TierStore(TierConfig config, Ticker ticker) {
        this(config.getMaxSize(), config.getDefaultTtl(), ticker);
    }

    public Optional<V> get(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key); // promotes to MRU
            if (entry == null) {
                return Optional.empty();
            }
            if (!entry.isLive(ticker.read())) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    public void set(String key, V value) {
        put(key, value, defaultTtlNanos);
    }

    /**
     * Stores {@code value} with an explicit ttl. {@code null} falls back to the tier default;
     * {@link CacheEntry#NO_EXPIRY} stores an entry that never expires.
     */
    public void set(String key, V value, Duration ttl) {
        put(key, value, ttl == null ? defaultTtlNanos : CacheEntry.toNanos(ttl));
    }

    private void put(String key, V value, long ttlNanos) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            if (entries.size() >= maxSize && !entries.containsKey(key)) {
                Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
                if (it.hasNext()) {
                    it.next();
                    it.remove();
                }
            }
            // on overwrite the access-ordered map moves the key to the tail as well
            entries.put(key, new CacheEntry<>(value, ticker.read(), ttlNanos));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Same as {@code get(key).isPresent()}, including expiry cleanup and promotion.
     */
    public boolean has(String key) {
        return get(key).isPresent();
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /** Number of stored entries, including expired ones that were not read yet. */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of the keys from least to most recently used. Does not touch recency. */
    public List<String> keys() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }
}
