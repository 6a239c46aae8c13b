package com.example.tieredcache.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class TierStoreTest {

    private final AtomicLong now = new AtomicLong();
    private final Ticker ticker = now::get;

    private TierStore<String> store;

    @BeforeEach
    public void setUp() {
        now.set(1_000_000L);
        store = new TierStore<>(3, Duration.ofSeconds(10), ticker);
    }

    private void advance(Duration d) {
        now.addAndGet(d.toNanos());
    }

    @Test
    public void testGetReturnsStoredValue() {
        store.set("a", "1");
        assertEquals("1", store.get("a").orElse(null));
        assertTrue(store.get("missing").isEmpty());
    }

    @Test
    public void testExpiryIsExactAroundTtl() {
        store.set("a", "1", Duration.ofMillis(100));

        advance(Duration.ofMillis(100).minusNanos(1));
        assertEquals("1", store.get("a").orElse(null), "still live just before ttl");

        advance(Duration.ofNanos(2));
        assertTrue(store.get("a").isEmpty(), "stale just after ttl");
        assertEquals(0, store.size(), "stale entry is removed on read");
    }

    @Test
    public void testEntryIsStaleExactlyAtTtl() {
        store.set("a", "1", Duration.ofMillis(100));
        advance(Duration.ofMillis(100));
        assertTrue(store.get("a").isEmpty());
    }

    @Test
    public void testDefaultTtlAppliesWhenOmitted() {
        store.set("a", "1");
        advance(Duration.ofSeconds(10).minusMillis(1));
        assertTrue(store.has("a"));
        advance(Duration.ofMillis(2));
        assertFalse(store.has("a"));
    }

    @Test
    public void testNullTtlFallsBackToDefault() {
        store.set("a", "1", null);
        advance(Duration.ofSeconds(11));
        assertTrue(store.get("a").isEmpty());
    }

    @Test
    public void testNoExpiryEntrySurvivesForever() {
        store.set("a", "1", CacheEntry.NO_EXPIRY);
        advance(Duration.ofDays(365 * 100));
        assertEquals("1", store.get("a").orElse(null));
    }

    @Test
    public void testEternalTierDefault() {
        TierStore<String> docs = new TierStore<>(2, null, ticker);
        docs.set("d", "x");
        advance(Duration.ofDays(10_000));
        assertTrue(docs.has("d"));
    }

    @Test
    public void testNegativeTtlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.set("a", "1", Duration.ofSeconds(-1)));
    }

    @Test
    public void testEvictsLeastRecentlyUsed() {
        store.set("k1", "1");
        store.set("k2", "2");
        store.set("k3", "3");

        assertTrue(store.get("k1").isPresent());
        store.set("k4", "4");

        assertFalse(store.has("k2"), "k2 was the least recently touched key");
        assertTrue(store.has("k1"));
        assertTrue(store.has("k3"));
        assertTrue(store.has("k4"));
        assertEquals(3, store.size());
    }

    @Test
    public void testEvictsInInsertionOrderWhenUntouched() {
        store.set("k1", "1");
        store.set("k2", "2");
        store.set("k3", "3");
        store.set("k4", "4");
        store.set("k5", "5");

        assertEquals(List.of("k3", "k4", "k5"), store.keys());
    }

    @Test
    public void testOverwriteAtCapacityDoesNotEvict() {
        store.set("k1", "1");
        store.set("k2", "2");
        store.set("k3", "3");

        store.set("k2", "two");

        assertEquals(3, store.size());
        assertEquals(List.of("k1", "k3", "k2"), store.keys(), "overwrite promotes the key");
        assertEquals("two", store.get("k2").orElse(null));
    }

    @Test
    public void testOverwriteResetsTtl() {
        store.set("a", "1", Duration.ofSeconds(1));
        advance(Duration.ofMillis(900));
        store.set("a", "2", Duration.ofSeconds(1));
        advance(Duration.ofMillis(900));
        assertEquals("2", store.get("a").orElse(null));
    }

    @Test
    public void testHasPromotesLikeGet() {
        store.set("k1", "1");
        store.set("k2", "2");
        store.set("k3", "3");

        assertTrue(store.has("k1"));
        store.set("k4", "4");

        assertEquals(List.of("k3", "k1", "k4"), store.keys());
    }

    @Test
    public void testHasRemovesExpiredEntry() {
        store.set("a", "1", Duration.ofMillis(5));
        advance(Duration.ofMillis(10));
        assertFalse(store.has("a"));
        assertEquals(0, store.size());
        assertTrue(store.keys().isEmpty());
    }

    @Test
    public void testKeysDoesNotTouchRecency() {
        store.set("k1", "1");
        store.set("k2", "2");
        store.keys();
        store.keys();
        assertEquals(List.of("k1", "k2"), store.keys());
    }

    @Test
    public void testDeleteAndClear() {
        store.set("a", "1");
        store.set("b", "2");

        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertEquals(1, store.size());

        store.clear();
        assertEquals(0, store.size());
        assertTrue(store.keys().isEmpty());
    }

    @Test
    public void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new TierStore<String>(0, null, ticker));
    }

    @Test
    public void testConcurrentAccessKeepsBound() throws Exception {
        TierStore<Integer> shared = new TierStore<>(64, Duration.ofMinutes(1));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int offset = t * 1000;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 5_000; i++) {
                    String key = "k" + ((offset + i) % 200);
                    shared.set(key, i);
                    shared.get("k" + (i % 200));
                    if (i % 7 == 0) {
                        shared.delete(key);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertTrue(shared.size() <= 64, "size must never exceed capacity: " + shared.size());
        List<String> keys = shared.keys();
        assertEquals(keys.size(), keys.stream().distinct().count(), "recency order has no duplicates");
    }
}
