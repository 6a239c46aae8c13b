package com.example.tieredcache.event.payload;

import java.time.Duration;
import java.util.Objects;

/**
 * Published on {@code query.executed} after every statement a connection runs.
 */
public final class QueryExecution {

    private final String connectionId;
    private final String query;
    private final Duration duration;
    private final Long rowsAffected;   // null when the driver did not report it
    private final Throwable error;

    public QueryExecution(String connectionId, String query, Duration duration) {
        this(connectionId, query, duration, null, null);
    }

    public QueryExecution(String connectionId, String query, Duration duration,
                          Long rowsAffected, Throwable error) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.query = Objects.requireNonNull(query, "query");
        this.duration = duration == null ? Duration.ZERO : duration;
        this.rowsAffected = rowsAffected;
        this.error = error;
    }

    public String getConnectionId() { return connectionId; }
    public String getQuery() { return query; }
    public Duration getDuration() { return duration; }
    public Long getRowsAffected() { return rowsAffected; }
    public Throwable getError() { return error; }

    @Override
    public String toString() {
        return "QueryExecution{connectionId=" + connectionId + ", duration=" + duration.toMillis() + "ms}";
    }
}
