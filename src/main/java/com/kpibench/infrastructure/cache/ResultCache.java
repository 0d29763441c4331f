package com.kpibench.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * In-process result cache shared by all query threads, backed by Caffeine.
 *
 * Caching Strategy:
 * - Bounded by entry count; Caffeine evicts by recency and frequency
 *   (Window TinyLFU) once the bound is exceeded
 * - Every entry carries its own TTL (short for cached absences)
 * - Time is read from the injected clock
 * - Maintenance runs on the calling thread; there is no background sweeper
 */
@Slf4j
public class ResultCache {

    private final Cache<String, Entry> cache;
    private final int maxSize;

    public ResultCache(int maxSize, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        Instant origin = clock.instant();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new EntryExpiry())
                .ticker(() -> Duration.between(origin, clock.instant()).toNanos())
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    /**
     * Get a cached value.
     *
     * @return empty on a miss, an expired entry, or a value of another type
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null || !type.isInstance(entry.value)) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        log.debug("Cache hit for key: {}", key);
        return Optional.of(type.cast(entry.value));
    }

    /**
     * Store a value; replaces any entry under the same key.
     */
    public void put(String key, Object value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot cache null for key " + key);
        }
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        cache.put(key, new Entry(value, ttl.toNanos()));
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttl.toSeconds());
    }

    public void invalidate(String key) {
        cache.invalidate(key);
        log.debug("Invalidated cache for key: {}", key);
    }

    /**
     * Drop every entry, e.g. when a new generation is published.
     */
    public void invalidateAll() {
        long removed = cache.estimatedSize();
        cache.invalidateAll();
        log.info("Result cache cleared ({} entries)", removed);
    }

    public int size() {
        cache.cleanUp();
        return (int) cache.estimatedSize();
    }

    public int maxSize() {
        return maxSize;
    }

    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return CacheStats.builder()
                .hits(stats.hitCount())
                .misses(stats.missCount())
                .evictions(stats.evictionCount())
                .size(size())
                .maxSize(maxSize)
                .hitRate(stats.hitRate())
                .build();
    }

    /**
     * Generate cache key from query parameters.
     */
    public static String generateCacheKey(String prefix, Object... params) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object param : params) {
            key.append(":").append(param != null ? param.toString() : "null");
        }
        return key.toString();
    }

    @Value
    @Builder
    public static class CacheStats {
        long hits;
        long misses;
        long evictions;
        int size;
        int maxSize;
        double hitRate;
    }

    private static final class Entry {
        private final Object value;
        private final long ttlNanos;

        private Entry(Object value, long ttlNanos) {
            this.value = value;
            this.ttlNanos = ttlNanos;
        }
    }

    // reads do not extend an entry's lifetime
    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
