package com.example.tieredcache.core;

/**
 * Snapshot of the manager-wide hit and miss counters.
 */
public final class CacheStats {

    private final long hits;
    private final long misses;

    public CacheStats(long hits, long misses) {
        this.hits = hits;
        this.misses = misses;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    /** {@code hits / (hits + misses)}, or 0 before the first lookup. */
    public double getHitRate() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) o;
        return hits == other.hits && misses == other.misses;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(hits) * 31 + Long.hashCode(misses);
    }

    @Override
    public String toString() {
        return "CacheStats{hits=" + hits + ", misses=" + misses + ", hitRate=" + getHitRate() + "}";
    }
}
