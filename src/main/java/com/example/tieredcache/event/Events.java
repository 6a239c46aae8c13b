package com.example.tieredcache.event;

import com.example.tieredcache.event.payload.AiRequest;
import com.example.tieredcache.event.payload.AiResponse;
import com.example.tieredcache.event.payload.ConnectionInfo;
import com.example.tieredcache.event.payload.ConnectionStateChange;
import com.example.tieredcache.event.payload.QueryExecution;

/**
 * Well-known topics. The bus accepts any other topic name as well.
 */
public final class Events {

    public static final EventType<ConnectionInfo> CONNECTION_ADDED =
        new EventType<>("connection.added", ConnectionInfo.class);

    /** Payload is the id of the removed connection. */
    public static final EventType<String> CONNECTION_REMOVED =
        new EventType<>("connection.removed", String.class);

    public static final EventType<ConnectionStateChange> CONNECTION_STATE_CHANGED =
        new EventType<>("connection.stateChanged", ConnectionStateChange.class);

    public static final EventType<QueryExecution> QUERY_EXECUTED =
        new EventType<>("query.executed", QueryExecution.class);

    public static final EventType<AiRequest> AI_REQUEST_SENT =
        new EventType<>("ai.requestSent", AiRequest.class);

    public static final EventType<AiResponse> AI_RESPONSE_RECEIVED =
        new EventType<>("ai.responseReceived", AiResponse.class);

    private Events() {
    }
}
