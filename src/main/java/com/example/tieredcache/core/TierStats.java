package com.example.tieredcache.core;

/**
 * Size and capacity of one tier. {@code hitRate} is the manager-wide rate, not a per-tier one.
 */
public final class TierStats {

    private final int size;
    private final int maxSize;
    private final double hitRate;

    public TierStats(int size, int maxSize, double hitRate) {
        this.size = size;
        this.maxSize = maxSize;
        this.hitRate = hitRate;
    }

    public int getSize() {
        return size;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public double getHitRate() {
        return hitRate;
    }

    @Override
    public String toString() {
        return "TierStats{size=" + size + ", maxSize=" + maxSize + ", hitRate=" + hitRate + "}";
    }
}
