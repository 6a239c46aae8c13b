package com.example.tieredcache.event.payload;

import java.util.Objects;

public final class ConnectionStateChange {

    public enum State { DISCONNECTED, CONNECTING, CONNECTED, ERROR }

    private final String connectionId;
    private final State oldState;
    private final State newState;
    private final Throwable error;

    public ConnectionStateChange(String connectionId, State oldState, State newState) {
        this(connectionId, oldState, newState, null);
    }

    public ConnectionStateChange(String connectionId, State oldState, State newState, Throwable error) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.oldState = Objects.requireNonNull(oldState, "oldState");
        this.newState = Objects.requireNonNull(newState, "newState");
        this.error = error;
    }

    public String getConnectionId() { return connectionId; }
    public State getOldState() { return oldState; }
    public State getNewState() { return newState; }
    public Throwable getError() { return error; }
}
