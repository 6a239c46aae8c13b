package com.example.tieredcache.event;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public final class EventBusStatistics {

    private final int totalHandlers;
    private final int pendingEvents;
    private final int historySize;
    private final Map<String, Integer> handlersByEvent;

    EventBusStatistics(int totalHandlers, int pendingEvents, int historySize, Map<String, Integer> handlersByEvent) {
        this.totalHandlers = totalHandlers;
        this.pendingEvents = pendingEvents;
        this.historySize = historySize;
        this.handlersByEvent = Collections.unmodifiableMap(new TreeMap<>(handlersByEvent));
    }

    public int getTotalHandlers() {
        return totalHandlers;
    }

    public int getPendingEvents() {
        return pendingEvents;
    }

    public int getHistorySize() {
        return historySize;
    }

    public Map<String, Integer> getHandlersByEvent() {
        return handlersByEvent;
    }
}
