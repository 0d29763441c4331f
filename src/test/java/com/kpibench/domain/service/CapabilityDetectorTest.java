package com.kpibench.domain.service;

import com.kpibench.domain.model.AccessMode;
import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.CapabilitySnapshot;
import com.kpibench.domain.model.KpiValue;
import com.kpibench.domain.model.QueryKind;
import com.kpibench.infrastructure.cache.ResultCache;
import com.kpibench.support.InMemoryLineItemStore;
import com.kpibench.support.InMemoryPrecomputedStore;
import com.kpibench.support.MutableClock;
import com.kpibench.support.TestCatalogs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CapabilityDetector mode transitions.
 */
class CapabilityDetectorTest {

    private InMemoryLineItemStore lineItemStore;
    private InMemoryPrecomputedStore precomputedStore;
    private GenerationHolder generationHolder;
    private ResultCache resultCache;
    private CapabilityDetector detector;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        lineItemStore = new InMemoryLineItemStore();
        precomputedStore = new InMemoryPrecomputedStore();
        resultCache = new ResultCache(100, clock);
        generationHolder = new GenerationHolder(resultCache);
        detector = new CapabilityDetector(precomputedStore, lineItemStore, generationHolder,
                TestCatalogs.catalog(), clock);
    }

    @Test
    void testNoGeneration_RawStoreReachable_IsRawFallback() {
        // When
        CapabilitySnapshot snapshot = detector.detect();

        // Then
        assertEquals(AccessMode.RAW_FALLBACK, snapshot.getKpiMode());
        assertEquals(AccessMode.RAW_FALLBACK, snapshot.getBenchmarkMode());
        assertNull(snapshot.getGenerationId());
    }

    @Test
    void testNothingReachable_IsUnavailable() {
        // Given
        lineItemStore.setReachable(false);
        precomputedStore.setReachable(false);

        // When
        CapabilitySnapshot snapshot = detector.detect();

        // Then
        assertEquals(AccessMode.UNAVAILABLE, snapshot.getKpiMode());
        assertEquals(AccessMode.UNAVAILABLE, snapshot.getBenchmarkMode());
    }

    @Test
    void testPublishedGeneration_IsLoadedAndPrecomputed() {
        // Given
        assertEquals(AccessMode.RAW_FALLBACK, detector.detect().getKpiMode());
        long generationId = publishGeneration();

        // When
        CapabilitySnapshot snapshot = detector.detect();

        // Then
        assertEquals(AccessMode.PRECOMPUTED, snapshot.getKpiMode());
        assertEquals(AccessMode.PRECOMPUTED, snapshot.getBenchmarkMode());
        assertEquals(generationId, snapshot.getGenerationId());
        GenerationIndex index = generationHolder.current().orElseThrow();
        assertEquals(1.5, index.kpis("e1", 2024).orElseThrow().get("current_ratio"), 0.0);
        assertTrue(index.benchmark("current_ratio", "all", "all", 2024).isPresent());
    }

    @Test
    void testKpiAndBenchmarkModesAreIndependent() {
        // Given: the KPI table fails its row-count check
        publishGeneration();
        precomputedStore.setKpiTableDamaged(true);

        // When
        CapabilitySnapshot snapshot = detector.detect();

        // Then
        assertEquals(AccessMode.RAW_FALLBACK, snapshot.getKpiMode());
        assertEquals(AccessMode.PRECOMPUTED, snapshot.getBenchmarkMode());
    }

    @Test
    void testLoadedGeneration_KeepsServingWhenStoresGoDown() {
        // Given
        publishGeneration();
        detector.detect();

        // When
        precomputedStore.setReachable(false);
        lineItemStore.setReachable(false);
        CapabilitySnapshot snapshot = detector.detect();

        // Then
        assertEquals(AccessMode.PRECOMPUTED, snapshot.getKpiMode());
        assertEquals(AccessMode.PRECOMPUTED, snapshot.getBenchmarkMode());
    }

    @Test
    void testNewGeneration_ReplacesHeldIndexAndClearsCache() {
        // Given
        long first = publishGeneration();
        detector.detect();
        resultCache.put("stale", "value", Duration.ofMinutes(5));

        // When
        long second = publishGeneration();
        detector.detect();

        // Then
        assertNotEquals(first, second);
        assertEquals(second, generationHolder.currentGenerationId().orElseThrow());
        assertEquals(0, resultCache.size());
    }

    @Test
    void testMarkStale_RedetectsOnNextModeLookup() {
        // Given
        assertEquals(AccessMode.RAW_FALLBACK, detector.currentMode(QueryKind.KPI_VALUES));
        lineItemStore.setReachable(false);

        // Then: no re-detection until marked stale
        assertEquals(AccessMode.RAW_FALLBACK, detector.currentMode(QueryKind.KPI_VALUES));
        detector.markStale();
        assertEquals(AccessMode.UNAVAILABLE, detector.currentMode(QueryKind.KPI_VALUES));
    }

    private long publishGeneration() {
        long generationId = precomputedStore.openGeneration();
        List<KpiValue> values = List.of(KpiValue.builder()
                .entityId("e1").period(2024).kpiKey("current_ratio").value(1.5).build());
        List<BenchmarkStat> stats = List.of(BenchmarkStat.builder()
                .kpiKey("current_ratio").scope("all").scopeKey("all").period(2024)
                .p25(1.5).median(1.5).p75(1.5).mean(1.5).sampleCount(1).build());
        precomputedStore.writeKpiValues(generationId, values);
        precomputedStore.writeBenchmarkStats(generationId, stats);
        precomputedStore.publish(generationId, values.size(), stats.size());
        return generationId;
    }
}
