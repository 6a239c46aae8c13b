package com.example.tieredcache;

import com.example.tieredcache.core.CacheKeys;
import com.example.tieredcache.core.CacheManager;
import com.example.tieredcache.event.EventBus;
import com.example.tieredcache.event.Events;
import com.example.tieredcache.event.payload.QueryExecution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class TieredCacheApplicationTest {

    @Autowired
    private CacheManager cacheManager;

    @Autowired
    private EventBus eventBus;

    @Autowired
    private TestRestTemplate rest;

    @BeforeEach
    public void setUp() {
        cacheManager.clear();
        eventBus.clearHistory();
    }

    @Test
    public void testTiersComeFromApplicationYaml() {
        assertEquals(List.of("schema", "query", "explain", "docs"), List.copyOf(cacheManager.getTierNames()));
        assertEquals(Duration.ofMinutes(5), cacheManager.getTierConfig("query").orElseThrow().getDefaultTtl());
        assertTrue(cacheManager.getTierConfig("docs").orElseThrow().isEternal());
    }

    @Test
    public void testWriteQueryEventInvalidatesThroughWiredBus() {
        String key = CacheKeys.query("c1", CacheKeys.hashQuery("SELECT * FROM users"));
        cacheManager.set(key, List.of("alice", "bob"));
        cacheManager.set(CacheKeys.explain("c1", "h"), "plan");

        eventBus.emit(Events.QUERY_EXECUTED,
            new QueryExecution("c1", "UPDATE users SET name = 'x'", Duration.ofMillis(2), 1L, null));

        assertFalse(cacheManager.has(key));
        assertTrue(cacheManager.has(CacheKeys.explain("c1", "h")));
        assertEquals(1, eventBus.getHistory().size());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testStatsEndpointReflectsManager() {
        cacheManager.set("docs:d1", "x");
        cacheManager.get("docs:d1");
        cacheManager.get("docs:d2");

        Map<String, Object> body = rest.getForObject("/cache/stats", Map.class);

        assertEquals(1, ((Number) body.get("hits")).intValue());
        assertEquals(1, ((Number) body.get("misses")).intValue());
        assertEquals(0.5, ((Number) body.get("hitRate")).doubleValue(), 1e-9);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testEventHistoryEndpoint() {
        eventBus.emit(Events.CONNECTION_REMOVED, "c9");

        List<Map<String, Object>> history = rest.getForObject("/events/history?count=5", List.class);

        assertEquals(1, history.size());
        assertEquals("connection.removed", history.get(0).get("type"));
        assertEquals("String", history.get(0).get("payloadType"));
    }
}
