package com.kpibench.domain.service;

import com.kpibench.infrastructure.cache.ResultCache;
import com.kpibench.support.MutableClock;
import com.kpibench.support.TestCatalogs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GenerationHolder swaps.
 */
class GenerationHolderTest {

    private ResultCache resultCache;
    private GenerationHolder holder;

    @BeforeEach
    void setUp() {
        resultCache = new ResultCache(100, new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
        holder = new GenerationHolder(resultCache);
    }

    @Test
    void testPublish_NewerGenerationSwapsAndClearsCache() {
        // Given
        assertTrue(holder.publish(index(1)));
        resultCache.put("kpis:1:310001:2024", "cached", Duration.ofMinutes(5));

        // When
        boolean swapped = holder.publish(index(2));

        // Then
        assertTrue(swapped);
        assertEquals(2L, holder.currentGenerationId().orElseThrow());
        assertEquals(0, resultCache.size());
    }

    @Test
    void testPublish_OlderGenerationIsIgnoredAndCacheKept() {
        // Given
        holder.publish(index(5));
        resultCache.put("kpis:5:310001:2024", "cached", Duration.ofMinutes(5));

        // When: a slow refresh delivers an older index after a newer build
        boolean swapped = holder.publish(index(4));

        // Then
        assertFalse(swapped);
        assertEquals(5L, holder.currentGenerationId().orElseThrow());
        assertEquals("cached", resultCache.get("kpis:5:310001:2024", String.class).orElseThrow());
    }

    @Test
    void testPublish_SameGenerationReplacesIndex() {
        // Given
        GenerationIndex first = index(3);
        GenerationIndex reloaded = index(3);
        holder.publish(first);

        // When
        boolean swapped = holder.publish(reloaded);

        // Then
        assertTrue(swapped);
        assertSame(reloaded, holder.current().orElseThrow());
    }

    private static GenerationIndex index(long generationId) {
        return GenerationIndex.of(generationId, List.of(), List.of(), TestCatalogs.KPI_KEYS);
    }
}
