package com.example.tieredcache.api;

import com.example.tieredcache.core.CacheManager;
import com.example.tieredcache.core.CacheStats;
import com.example.tieredcache.core.TierStats;
import com.example.tieredcache.event.EventBus;
import com.example.tieredcache.event.EventBusStatistics;
import com.example.tieredcache.event.EventEnvelope;

import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin surface over the cache manager and the event bus.
 */
@RestController
public class CacheController {

    private final CacheManager cacheManager;
    private final EventBus eventBus;

    public CacheController(CacheManager cacheManager, EventBus eventBus) {
        this.cacheManager = cacheManager;
        this.eventBus = eventBus;
    }

    @GetMapping("/cache/stats")
    public Map<String, Object> getStats() {
        CacheStats stats = cacheManager.getStats();
        return Map.of(
            "hits", stats.getHits(),
            "misses", stats.getMisses(),
            "hitRate", stats.getHitRate(),
            "version", cacheManager.getVersion()
        );
    }

    @GetMapping("/cache/stats/tiers")
    public Map<String, TierStats> getTierStats() {
        return cacheManager.getDetailedStats();
    }

    @PostMapping("/cache/clear")
    public Map<String, Object> clear() {
        cacheManager.clear();
        return Map.of("version", cacheManager.getVersion());
    }

    @PostMapping("/cache/tiers/{tier}/clear")
    public void clearTier(@PathVariable String tier) {
        cacheManager.clearTier(tier);
    }

    @DeleteMapping("/cache/entries")
    public Map<String, Object> invalidate(@RequestParam String key) {
        return Map.of("removed", cacheManager.invalidate(key));
    }

    @DeleteMapping("/cache/entries/pattern")
    public Map<String, Object> invalidatePattern(@RequestParam String regex) {
        return Map.of("removed", cacheManager.invalidatePattern(regex));
    }

    @PostMapping("/cache/connections/{connectionId}/schema-changed")
    public Map<String, Object> schemaChanged(
        @PathVariable String connectionId,
        @RequestParam(required = false) String schema
    ) {
        return Map.of("removed", cacheManager.onSchemaChanged(connectionId, schema));
    }

    @DeleteMapping("/cache/connections/{connectionId}")
    public Map<String, Object> connectionRemoved(@PathVariable String connectionId) {
        return Map.of("removed", cacheManager.onConnectionRemoved(connectionId));
    }

    @GetMapping("/events/history")
    public List<Map<String, Object>> getHistory(@RequestParam(defaultValue = "0") int count) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (EventEnvelope event : eventBus.getHistory(count)) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", event.getId());
            view.put("type", event.getType());
            view.put("priority", event.getPriority().name());
            view.put("timestamp", event.getTimestamp().toString());
            view.put("payloadType", event.getData() == null ? null : event.getData().getClass().getSimpleName());
            out.add(view);
        }
        return out;
    }

    @GetMapping("/events/stats")
    public EventBusStatistics getEventStats() {
        return eventBus.getStatistics();
    }
}
