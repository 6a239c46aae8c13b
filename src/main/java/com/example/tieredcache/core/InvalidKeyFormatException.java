package com.example.tieredcache.core;

/**
 * Thrown when a cache key has no {@code tier:} prefix.
 */
public class InvalidKeyFormatException extends IllegalArgumentException {

    private final String key;

    public InvalidKeyFormatException(String key) {
        super("Invalid cache key format: " + key + ". Expected format: cacheName:key");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
