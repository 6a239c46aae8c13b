package com.example.tieredcache.event;

import java.util.Objects;

/**
 * A topic name bound to the payload class its events carry.
 */
public final class EventType<T> {

    private final String name;
    private final Class<T> payloadType;

    public EventType(String name, Class<T> payloadType) {
        this.name = Objects.requireNonNull(name, "name");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
    }

    public String getName() {
        return name;
    }

    public Class<T> getPayloadType() {
        return payloadType;
    }

    T cast(Object data) {
        return payloadType.cast(data);
    }

    @Override
    public String toString() {
        return name;
    }
}
