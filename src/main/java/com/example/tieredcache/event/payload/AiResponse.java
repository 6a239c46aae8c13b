package com.example.tieredcache.event.payload;

import java.time.Duration;

public final class AiResponse {

    private final String type;
    private final Duration duration;
    private final boolean success;
    private final Throwable error;

    public AiResponse(String type, Duration duration, boolean success, Throwable error) {
        this.type = type;
        this.duration = duration;
        this.success = success;
        this.error = error;
    }

    public String getType() { return type; }
    public Duration getDuration() { return duration; }
    public boolean isSuccess() { return success; }
    public Throwable getError() { return error; }
}
