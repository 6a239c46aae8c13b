package com.example.tieredcache.config;

import com.example.tieredcache.core.TierConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tier table and event bus settings.
 *
 * <pre>
 * tiered-cache:
 *   tiers:
 *     schema:
 *       max-size: 100
 *       default-ttl: 1h
 *     docs:
 *       max-size: 200      # no default-ttl: never expires
 *   event-bus:
 *     history-size: 100
 *     dispatch-threads: 4
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "tiered-cache")
public class TieredCacheProperties {

    /** Tiers by name. When empty, the stock schema/query/explain/docs table is used. */
    @Valid
    private Map<String, Tier> tiers = new LinkedHashMap<>();

    @Valid
    private EventBusSettings eventBus = new EventBusSettings();

    public Map<String, Tier> getTiers() {
        return tiers;
    }

    public void setTiers(Map<String, Tier> tiers) {
        this.tiers = tiers;
    }

    public EventBusSettings getEventBus() {
        return eventBus;
    }

    public void setEventBus(EventBusSettings eventBus) {
        this.eventBus = eventBus;
    }

    public List<TierConfig> toTierConfigs() {
        if (tiers.isEmpty()) {
            return TierConfig.defaults();
        }
        List<TierConfig> configs = new ArrayList<>(tiers.size());
        for (Map.Entry<String, Tier> e : tiers.entrySet()) {
            configs.add(new TierConfig(e.getKey(), e.getValue().getMaxSize(), e.getValue().getDefaultTtl()));
        }
        return configs;
    }

    public static class Tier {

        /** Entry-count bound. */
        @Positive
        private int maxSize = 100;

        /** Lifetime used when a write gives none. Unset or negative: never expires. */
        private Duration defaultTtl;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }
    }

    public static class EventBusSettings {

        /** Number of published events kept for inspection. */
        @Positive
        private int historySize = 100;

        /** Threads running the handlers of one event concurrently. */
        @Positive
        private int dispatchThreads = 4;

        public int getHistorySize() {
            return historySize;
        }

        public void setHistorySize(int historySize) {
            this.historySize = historySize;
        }

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
        }
    }
}
