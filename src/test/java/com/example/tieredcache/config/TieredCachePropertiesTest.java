package com.example.tieredcache.config;

import com.example.tieredcache.core.TierConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TieredCachePropertiesTest {

    private static TieredCacheProperties bind(Map<String, String> source) {
        return new Binder(new MapConfigurationPropertySource(source))
            .bindOrCreate("tiered-cache", TieredCacheProperties.class);
    }

    @Test
    public void testEmptyConfigurationFallsBackToDefaults() {
        TieredCacheProperties properties = bind(Map.of());

        List<TierConfig> tiers = properties.toTierConfigs();
        assertEquals(4, tiers.size());
        assertEquals("schema", tiers.get(0).getName());
        assertEquals(Duration.ofHours(1), tiers.get(0).getDefaultTtl());
        assertTrue(tiers.get(3).isEternal());
        assertEquals(100, properties.getEventBus().getHistorySize());
        assertEquals(4, properties.getEventBus().getDispatchThreads());
    }

    @Test
    public void testBindsTierTable() {
        Map<String, String> source = new LinkedHashMap<>();
        source.put("tiered-cache.tiers.hot.max-size", "5");
        source.put("tiered-cache.tiers.hot.default-ttl", "30s");
        source.put("tiered-cache.tiers.forever.max-size", "7");
        source.put("tiered-cache.tiers.forever.default-ttl", "-1");
        source.put("tiered-cache.event-bus.history-size", "20");
        source.put("tiered-cache.event-bus.dispatch-threads", "2");

        TieredCacheProperties properties = bind(source);
        List<TierConfig> tiers = properties.toTierConfigs();

        assertEquals(2, tiers.size());
        TierConfig hot = tiers.stream().filter(t -> t.getName().equals("hot")).findFirst().orElseThrow();
        assertEquals(5, hot.getMaxSize());
        assertEquals(Duration.ofSeconds(30), hot.getDefaultTtl());
        TierConfig forever = tiers.stream().filter(t -> t.getName().equals("forever")).findFirst().orElseThrow();
        assertTrue(forever.isEternal());
        assertEquals(20, properties.getEventBus().getHistorySize());
        assertEquals(2, properties.getEventBus().getDispatchThreads());
    }

    @Test
    public void testTierConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TierConfig("bad", 0, null));
        assertThrows(IllegalArgumentException.class, () -> new TierConfig("a:b", 1, null));
        assertThrows(IllegalArgumentException.class, () -> new TierConfig("", 1, null));
        assertThrows(NullPointerException.class, () -> new TierConfig(null, 1, null));
    }
}
