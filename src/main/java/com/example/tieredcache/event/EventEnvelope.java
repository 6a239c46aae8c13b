package com.example.tieredcache.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable message published on the {@link EventBus}.
 */
public final class EventEnvelope {

    private final long sequence;
    private final String type;
    private final Object data;
    private final EventPriority priority;
    private final Instant timestamp;

    EventEnvelope(long sequence, String type, Object data, EventPriority priority, Instant timestamp) {
        this.sequence = sequence;
        this.type = Objects.requireNonNull(type, "type");
        this.data = data;
        this.priority = Objects.requireNonNull(priority, "priority");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    /** Unique id of the form {@code event-<sequence>}. */
    public String getId() {
        return "event-" + sequence;
    }

    /** Strictly increasing publication number; also the tie-breaker between equal priorities. */
    public long getSequence() {
        return sequence;
    }

    public String getType() {
        return type;
    }

    public Object getData() {
        return data;
    }

    public <T> T getData(Class<T> payloadType) {
        return payloadType.cast(data);
    }

    public EventPriority getPriority() {
        return priority;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "EventEnvelope{id=" + getId() + ", type=" + type + ", priority=" + priority
            + ", timestamp=" + timestamp + "}";
    }
}
