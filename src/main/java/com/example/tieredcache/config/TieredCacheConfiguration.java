package com.example.tieredcache.config;

import com.example.tieredcache.core.CacheManager;
import com.example.tieredcache.event.EventBus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(TieredCacheProperties.class)
public class TieredCacheConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService eventDispatchExecutor(TieredCacheProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "event-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(properties.getEventBus().getDispatchThreads(), threads);
    }

    @Bean(destroyMethod = "close")
    public EventBus eventBus(TieredCacheProperties properties,
                             @Qualifier("eventDispatchExecutor") ExecutorService eventDispatchExecutor) {
        return new EventBus(properties.getEventBus().getHistorySize(), eventDispatchExecutor);
    }

    @Bean(destroyMethod = "close")
    public CacheManager cacheManager(TieredCacheProperties properties, EventBus eventBus) {
        return new CacheManager(properties.toTierConfigs(), eventBus);
    }
}
