package com.example.tieredcache.core;

/**
 * Builders for the canonical composite keys.
 */
public final class CacheKeys {

    public static final String SCHEMA = "schema";
    public static final String QUERY = "query";
    public static final String EXPLAIN = "explain";
    public static final String DOCS = "docs";

    private CacheKeys() {
    }

    public static String schema(String connectionId, String database) {
        return SCHEMA + ":" + connectionId + ":" + database;
    }

    public static String schema(String connectionId, String database, String table) {
        return table == null ? schema(connectionId, database) : schema(connectionId, database) + ":" + table;
    }

    public static String query(String connectionId, String queryHash) {
        return QUERY + ":" + connectionId + ":" + queryHash;
    }

    public static String explain(String connectionId, String queryHash) {
        return EXPLAIN + ":" + connectionId + ":" + queryHash;
    }

    public static String docs(String docId) {
        return DOCS + ":" + docId;
    }

    /**
     * Order-sensitive 32-bit rolling hash ({@code h = 31 * h + c}) rendered in base 36.
     * Not collision free.
     */
    public static String hashQuery(String query) {
        int hash = 0;
        for (int i = 0; i < query.length(); i++) {
            hash = (hash << 5) - hash + query.charAt(i);
        }
        return Long.toString(Math.abs((long) hash), 36);
    }
}
