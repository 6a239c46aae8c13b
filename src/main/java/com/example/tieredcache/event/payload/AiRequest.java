package com.example.tieredcache.event.payload;

import java.time.Instant;

public final class AiRequest {

    private final String type;
    private final String query;
    private final boolean anonymized;
    private final Instant timestamp;

    public AiRequest(String type, String query, boolean anonymized, Instant timestamp) {
        this.type = type;
        this.query = query;
        this.anonymized = anonymized;
        this.timestamp = timestamp;
    }

    public String getType() { return type; }
    public String getQuery() { return query; }
    public boolean isAnonymized() { return anonymized; }
    public Instant getTimestamp() { return timestamp; }
}
