package com.example.tieredcache.core;

import com.example.tieredcache.event.EventBus;
import com.example.tieredcache.event.Events;
import com.example.tieredcache.event.Subscription;
import com.example.tieredcache.event.payload.QueryExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Routes {@code tier:key} composite keys to per-tier LRU stores and invalidates entries
 * on demand or in reaction to {@code query.executed} events.
 *
 * <p>Keys are split on the first colon only; whatever follows it is the key inside the tier.
 * A key without a colon is a caller bug and fails with {@link InvalidKeyFormatException}.
 * An unknown tier is only logged: lookups count as misses and writes are dropped.
 */
public class CacheManager {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private static final Pattern WRITE_STATEMENT = Pattern.compile(
        "^\\s*(INSERT|UPDATE|DELETE|ALTER|DROP|TRUNCATE|CREATE|RENAME)\\b", Pattern.CASE_INSENSITIVE);

    // end of an identifier segment: the next separator or the end of the key
    private static final String SEGMENT_END = "(?::|$)";

    private final Map<String, TierStore<Object>> tiers;
    private final Map<String, TierConfig> configs;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong version = new AtomicLong(1);

    private final Subscription querySubscription;

    public CacheManager(List<TierConfig> tierConfigs) {
        this(tierConfigs, null, Ticker.system());
    }

    public CacheManager(List<TierConfig> tierConfigs, EventBus eventBus) {
        this(tierConfigs, eventBus, Ticker.system());
    }

    /**
     * @param eventBus bus to watch for write statements; may be {@code null}
     */
    public CacheManager(List<TierConfig> tierConfigs, EventBus eventBus, Ticker ticker) {
        Objects.requireNonNull(tierConfigs, "tierConfigs");
        Objects.requireNonNull(ticker, "ticker");
        Map<String, TierStore<Object>> stores = new LinkedHashMap<>();
        Map<String, TierConfig> byName = new LinkedHashMap<>();
        for (TierConfig config : tierConfigs) {
            if (byName.putIfAbsent(config.getName(), config) != null) {
                throw new IllegalArgumentException("Duplicate tier: " + config.getName());
            }
            stores.put(config.getName(), new TierStore<>(config, ticker));
        }
        this.tiers = Collections.unmodifiableMap(stores);
        this.configs = Collections.unmodifiableMap(byName);

        this.querySubscription = eventBus == null
            ? null
            : eventBus.on(Events.QUERY_EXECUTED, this::onQueryExecuted);
        log.info("Cache manager initialized with tiers {}", configs.values());
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        String[] parts = parseKey(key);
        TierStore<Object> store = tiers.get(parts[0]);
        if (store == null) {
            log.warn("Cache not found: {}", parts[0]);
            misses.incrementAndGet();
            return Optional.empty();
        }

        Optional<Object> value = store.get(parts[1]);
        if (value.isPresent()) {
            hits.incrementAndGet();
            log.debug("Cache hit: {}", key);
        } else {
            misses.incrementAndGet();
            log.debug("Cache miss: {}", key);
        }
        return (Optional<T>) value;
    }

    public <T> void set(String key, T value) {
        set(key, value, null);
    }

    /**
     * @param ttl lifetime of the entry; {@code null} for the tier default,
     *            {@link CacheEntry#NO_EXPIRY} for an entry that never expires
     */
    public <T> void set(String key, T value, Duration ttl) {
        String[] parts = parseKey(key);
        TierStore<Object> store = tiers.get(parts[0]);
        if (store == null) {
            log.warn("Cache not found: {}", parts[0]);
            return;
        }
        store.set(parts[1], value, ttl);
        log.debug("Cache set: {}", key);
    }

    /**
     * Liveness check with the same expiry and recency side effects as {@link #get(String)}.
     * Does not count towards hits or misses unless the tier is unknown.
     */
    public boolean has(String key) {
        String[] parts = parseKey(key);
        TierStore<Object> store = tiers.get(parts[0]);
        if (store == null) {
            log.warn("Cache not found: {}", parts[0]);
            misses.incrementAndGet();
            return false;
        }
        return store.has(parts[1]);
    }

    public boolean invalidate(String key) {
        String[] parts = parseKey(key);
        TierStore<Object> store = tiers.get(parts[0]);
        if (store == null) {
            log.warn("Cache not found: {}", parts[0]);
            misses.incrementAndGet();
            return false;
        }
        boolean removed = store.delete(parts[1]);
        log.debug("Cache invalidated: {}", key);
        return removed;
    }

    /**
     * Removes every entry, in every tier, whose fully qualified {@code tier:key} contains a
     * match for {@code pattern}. Anchor the pattern with {@code ^} to match prefixes.
     *
     * @return number of entries removed
     */
    public int invalidatePattern(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        int count = 0;
        for (Map.Entry<String, TierStore<Object>> tier : tiers.entrySet()) {
            TierStore<Object> store = tier.getValue();
            for (String key : store.keys()) {
                if (pattern.matcher(tier.getKey() + ":" + key).find() && store.delete(key)) {
                    count++;
                }
            }
        }
        log.info("Invalidated {} cache entries matching pattern: {}", count, pattern);
        return count;
    }

    /**
     * Compiles {@code regex} as is. Identifiers taken from outside must be quoted first.
     *
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    public int invalidatePattern(String regex) {
        return invalidatePattern(Pattern.compile(regex));
    }

    /**
     * Drops cached schema metadata for a connection, or for one of its schemas, together
     * with every query and explain result of that connection. A schema name matches as a
     * prefix, so {@code db1} also covers {@code db1:users} and {@code db10}.
     *
     * @param schema schema whose metadata changed, or {@code null} for all of them
     * @return number of entries removed
     */
    public int onSchemaChanged(String connectionId, String schema) {
        Objects.requireNonNull(connectionId, "connectionId");
        String schemaPrefix = "^" + CacheKeys.SCHEMA + ":" + Pattern.quote(connectionId);
        Pattern schemaPattern = schema == null
            ? Pattern.compile(schemaPrefix + SEGMENT_END)
            : Pattern.compile(schemaPrefix + ":" + Pattern.quote(schema));

        int removed = invalidatePattern(schemaPattern);
        removed += invalidatePattern(Pattern.compile(
            "^(?:" + CacheKeys.QUERY + "|" + CacheKeys.EXPLAIN + "):" + Pattern.quote(connectionId) + SEGMENT_END));

        log.info("Invalidated caches for connection {} due to schema change", connectionId);
        return removed;
    }

    public int onSchemaChanged(String connectionId) {
        return onSchemaChanged(connectionId, null);
    }

    /**
     * Drops every entry of every tier whose first key segment is {@code connectionId}.
     *
     * @return number of entries removed
     */
    public int onConnectionRemoved(String connectionId) {
        Objects.requireNonNull(connectionId, "connectionId");
        int removed = invalidatePattern(Pattern.compile("^[^:]+:" + Pattern.quote(connectionId) + SEGMENT_END));
        log.info("Invalidated all caches for removed connection {}", connectionId);
        return removed;
    }

    void onQueryExecuted(QueryExecution execution) {
        if (!isWriteStatement(execution.getQuery())) {
            return;
        }
        invalidatePattern(Pattern.compile(
            "^" + CacheKeys.QUERY + ":" + Pattern.quote(execution.getConnectionId()) + ":"));
        log.debug("Cache invalidated for write operation on connection: {}", execution.getConnectionId());
    }

    /** True when the statement's leading keyword modifies data or schema. */
    public static boolean isWriteStatement(String sql) {
        return sql != null && WRITE_STATEMENT.matcher(sql).find();
    }

    /**
     * Empties every tier, resets the counters and bumps the version.
     */
    public void clear() {
        for (TierStore<Object> store : tiers.values()) {
            store.clear();
        }
        hits.set(0);
        misses.set(0);
        version.incrementAndGet();
        log.info("All caches cleared");
    }

    /** Empties one tier. Unknown names are ignored. */
    public void clearTier(String tierName) {
        TierStore<Object> store = tiers.get(tierName);
        if (store != null) {
            store.clear();
            log.info("Cleared cache tier: {}", tierName);
        }
    }

    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get());
    }

    /**
     * Per-tier size and capacity, in configuration order. Every tier reports the global hit rate.
     */
    public Map<String, TierStats> getDetailedStats() {
        double hitRate = getStats().getHitRate();
        Map<String, TierStats> stats = new LinkedHashMap<>();
        for (Map.Entry<String, TierStore<Object>> tier : tiers.entrySet()) {
            TierStore<Object> store = tier.getValue();
            stats.put(tier.getKey(), new TierStats(store.size(), store.getMaxSize(), hitRate));
        }
        return stats;
    }

    /** Starts at 1 and grows by one on every {@link #clear()}. */
    public long getVersion() {
        return version.get();
    }

    public Set<String> getTierNames() {
        return tiers.keySet();
    }

    public Optional<TierConfig> getTierConfig(String tierName) {
        return Optional.ofNullable(configs.get(tierName));
    }

    /**
     * Stops listening for query events and clears every tier.
     */
    public void close() {
        if (querySubscription != null) {
            querySubscription.unsubscribe();
        }
        clear();
        log.info("Cache manager disposed");
    }

    private static String[] parseKey(String key) {
        Objects.requireNonNull(key, "key");
        int sep = key.indexOf(':');
        if (sep < 0) {
            throw new InvalidKeyFormatException(key);
        }
        return new String[] {key.substring(0, sep), key.substring(sep + 1)};
    }
}
