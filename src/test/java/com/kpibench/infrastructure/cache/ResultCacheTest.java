package com.kpibench.infrastructure.cache;

import com.kpibench.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResultCache.
 */
class ResultCacheTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void testPutAndGet() {
        // Given
        ResultCache cache = new ResultCache(10, clock);

        // When
        cache.put("k", "value", TTL);

        // Then
        assertEquals("value", cache.get("k", String.class).orElseThrow());
        assertTrue(cache.get("k", Integer.class).isEmpty());
        assertTrue(cache.get("other", String.class).isEmpty());
    }

    @Test
    void testNoEvictionUntilMaxSizeReached() {
        // Given
        ResultCache cache = new ResultCache(10_000, clock);

        // When
        for (int i = 0; i < 10_000; i++) {
            cache.put("k" + i, i, TTL);
        }

        // Then: every entry is retained at exactly the bound
        assertEquals(10_000, cache.size());
        assertEquals(0, cache.stats().getEvictions());

        // When: one more entry
        cache.put("overflow", -1, TTL);

        // Then
        assertEquals(10_000, cache.size());
        assertEquals(1, cache.stats().getEvictions());
    }

    @Test
    void testEviction_FrequentlyReadEntrySurvives() {
        // Given
        ResultCache cache = new ResultCache(3, clock);
        cache.put("a", "A", TTL);
        cache.put("b", "B", TTL);
        cache.put("c", "C", TTL);

        // When: read "a" repeatedly, then overflow
        for (int i = 0; i < 5; i++) {
            cache.get("a", String.class);
        }
        cache.put("d", "D", TTL);

        // Then
        assertEquals(3, cache.size());
        assertEquals(1, cache.stats().getEvictions());
        assertTrue(cache.get("a", String.class).isPresent());
    }

    @Test
    void testTtlExpiry_PerEntry() {
        // Given
        ResultCache cache = new ResultCache(10, clock);
        cache.put("short", "S", Duration.ofSeconds(30));
        cache.put("long", "L", TTL);

        // When
        clock.advance(Duration.ofSeconds(29));
        assertTrue(cache.get("short", String.class).isPresent());
        clock.advance(Duration.ofSeconds(1));

        // Then
        assertTrue(cache.get("short", String.class).isEmpty());
        assertTrue(cache.get("long", String.class).isPresent());

        // expired entries are dropped by maintenance once their timer bucket passes
        clock.advance(Duration.ofSeconds(5));
        assertEquals(1, cache.size());
    }

    @Test
    void testNonPositiveTtl_NotCached() {
        ResultCache cache = new ResultCache(10, clock);

        cache.put("k", "v", Duration.ZERO);

        assertTrue(cache.get("k", String.class).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> cache.put("k", null, TTL));
    }

    @Test
    void testInvalidate() {
        ResultCache cache = new ResultCache(100, clock);
        cache.put("a", "A", TTL);
        cache.put("b", "B", TTL);
        cache.put("c", "C", TTL);

        cache.invalidate("a");
        assertTrue(cache.get("a", String.class).isEmpty());
        assertEquals(2, cache.size());

        cache.invalidateAll();
        assertEquals(0, cache.size());
    }

    @Test
    void testNonPositiveMaxSize_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ResultCache(0, clock));
    }

    @Test
    void testReadDoesNotExtendTtl() {
        ResultCache cache = new ResultCache(10, clock);
        cache.put("k", "v", Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(20));
        assertTrue(cache.get("k", String.class).isPresent());
        clock.advance(Duration.ofSeconds(10));

        assertTrue(cache.get("k", String.class).isEmpty());
    }

    @Test
    void testStats() {
        ResultCache cache = new ResultCache(10, clock);
        cache.put("a", "A", TTL);

        cache.get("a", String.class);
        cache.get("a", String.class);
        cache.get("a", String.class);
        cache.get("missing", String.class);

        ResultCache.CacheStats stats = cache.stats();
        assertEquals(3, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(0.75, stats.getHitRate(), 1e-12);
        assertEquals(1, stats.getSize());
        assertEquals(10, stats.getMaxSize());
    }

    @Test
    void testSizeBoundHoldsUnderConcurrentWriters() throws Exception {
        // Given
        ResultCache cache = new ResultCache(64, clock);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < 8; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 2_000; i++) {
                    cache.put("t" + thread + ":" + i, i, TTL);
                    cache.get("t" + thread + ":" + (i / 2), Integer.class);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertTrue(cache.size() <= 64, "size " + cache.size());
        assertEquals(8 * 2_000 - cache.size(), cache.stats().getEvictions());
    }
}
