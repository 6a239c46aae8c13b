package com.example.tieredcache.event.payload;

import java.util.Objects;

/**
 * Connection announced on {@code connection.added}.
 */
public final class ConnectionInfo {

    public enum Environment { DEV, STAGING, PROD }

    private final String id;
    private final String name;
    private final String type;
    private final String host;
    private final int port;
    private final String database;     // nullable
    private final Environment environment;
    private final boolean connected;

    public ConnectionInfo(String id, String name, String type, String host, int port,
                          String database, Environment environment, boolean connected) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.type = type;
        this.host = host;
        this.port = port;
        this.database = database;
        this.environment = environment;
        this.connected = connected;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getType() { return type; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public Environment getEnvironment() { return environment; }
    public boolean isConnected() { return connected; }
}
