package com.example.tieredcache.event;

@FunctionalInterface
public interface EventHandler {

    void handle(EventEnvelope event) throws Exception;
}
