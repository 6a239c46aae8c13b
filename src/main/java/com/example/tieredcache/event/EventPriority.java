package com.example.tieredcache.event;

/**
 * Dispatch priority of an event. Higher values are dispatched first.
 */
public enum EventPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int weight;

    EventPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
