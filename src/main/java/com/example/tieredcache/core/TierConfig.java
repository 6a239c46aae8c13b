package com.example.tieredcache.core;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Static settings of one named tier. A {@code null} default ttl means entries never expire.
 */
public final class TierConfig {

    private final String name;
    private final int maxSize;
    private final Duration defaultTtl;

    public TierConfig(String name, int maxSize, Duration defaultTtl) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isEmpty() || name.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Invalid tier name: '" + name + "'");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive for tier " + name + ": " + maxSize);
        }
        this.maxSize = maxSize;
        this.defaultTtl = (defaultTtl == null || defaultTtl.isNegative()) ? null : defaultTtl;
    }

    public static TierConfig eternal(String name, int maxSize) {
        return new TierConfig(name, maxSize, null);
    }

    /**
     * The stock table: schema, query, explain and docs.
     */
    public static List<TierConfig> defaults() {
        return List.of(
            new TierConfig("schema", 100, Duration.ofHours(1)),
            new TierConfig("query", 50, Duration.ofMinutes(5)),
            new TierConfig("explain", 50, Duration.ofMinutes(10)),
            eternal("docs", 200)
        );
    }

    public String getName() {
        return name;
    }

    public int getMaxSize() {
        return maxSize;
    }

    /** Default ttl, or {@code null} when entries in this tier never expire. */
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public boolean isEternal() {
        return defaultTtl == null;
    }

    @Override
    public String toString() {
        return "TierConfig{name=" + name + ", maxSize=" + maxSize
            + ", defaultTtl=" + (defaultTtl == null ? "none" : defaultTtl) + "}";
    }
}
