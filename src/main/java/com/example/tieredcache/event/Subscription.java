package com.example.tieredcache.event;

/**
 * Handle returned by {@link EventBus#on}. Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
