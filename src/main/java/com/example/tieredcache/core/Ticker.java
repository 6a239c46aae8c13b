package com.example.tieredcache.core;

/**
 * Monotonic nanosecond time source used for entry expiry.
 */
@FunctionalInterface
public interface Ticker {

    long read();

    static Ticker system() {
        return System::nanoTime;
    }
}
