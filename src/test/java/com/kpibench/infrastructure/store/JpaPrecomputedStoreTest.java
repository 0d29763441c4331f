package com.kpibench.infrastructure.store;

import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.BuildStage;
import com.kpibench.domain.model.KpiValue;
import com.kpibench.infrastructure.persistence.entity.BuildGenerationEntity;
import com.kpibench.infrastructure.persistence.entity.KpiValueEntity;
import com.kpibench.infrastructure.persistence.repository.BuildGenerationRepository;
import com.kpibench.infrastructure.persistence.repository.KpiValueRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Generation lifecycle of JpaPrecomputedStore against an embedded database.
 */
@DataJpaTest
@Import(JpaPrecomputedStore.class)
class JpaPrecomputedStoreTest {

    @Autowired
    private JpaPrecomputedStore store;

    @Autowired
    private BuildGenerationRepository buildGenerationRepository;

    @Autowired
    private KpiValueRepository kpiValueRepository;

    @Test
    void testProbe_NothingPublished() {
        GenerationProbe probe = store.probe();

        assertFalse(probe.hasGeneration());
    }

    @Test
    void testPublish_MakesGenerationReadable() {
        // Given
        long generationId = store.openGeneration();
        store.writeKpiValues(generationId, List.of(kpi("310001", "current_ratio", 5.76), kpi("310001", "margin", null)));
        store.writeBenchmarkStats(generationId, List.of(stat("current_ratio", "all", "all", 5.76)));

        // When
        store.publish(generationId, 2, 1);

        // Then
        GenerationProbe probe = store.probe();
        assertEquals(generationId, probe.getGenerationId());
        assertTrue(probe.isKpiValuesReadable());
        assertTrue(probe.isBenchmarkStatsReadable());

        List<KpiValue> values = store.loadKpiValues(generationId);
        assertEquals(2, values.size());
        assertTrue(values.stream().anyMatch(v -> "margin".equals(v.getKpiKey()) && v.getValue() == null));
        assertEquals(List.of(stat("current_ratio", "all", "all", 5.76)), store.loadBenchmarkStats(generationId));

        BuildGenerationEntity generation = buildGenerationRepository.findById(generationId).orElseThrow();
        assertEquals(BuildGenerationEntity.Status.PUBLISHED, generation.getStatus());
    }

    @Test
    void testProbe_DetectsMissingRows() {
        // Given
        long generationId = store.openGeneration();
        store.writeKpiValues(generationId, List.of(kpi("310001", "current_ratio", 5.76)));
        store.writeBenchmarkStats(generationId, List.of(stat("current_ratio", "all", "all", 5.76)));
        store.publish(generationId, 1, 1);

        // When: the KPI table loses its rows
        kpiValueRepository.deleteByGeneration(generationId);

        // Then
        GenerationProbe probe = store.probe();
        assertFalse(probe.isKpiValuesReadable());
        assertTrue(probe.isBenchmarkStatsReadable());
    }

    @Test
    void testDiscard_RemovesRowsAndRecordsFailure() {
        // Given
        long published = store.openGeneration();
        store.writeKpiValues(published, List.of(kpi("310001", "current_ratio", 5.76)));
        store.publish(published, 1, 0);

        long failed = store.openGeneration();
        store.writeKpiValues(failed, List.of(kpi("310001", "current_ratio", 9.0)));

        // When
        store.discard(failed, BuildStage.BUILD_INDEXES, null, "disk full");

        // Then
        assertEquals(0, kpiValueRepository.countByGenerationId(failed));
        BuildGenerationEntity generation = buildGenerationRepository.findById(failed).orElseThrow();
        assertEquals(BuildGenerationEntity.Status.FAILED, generation.getStatus());
        assertEquals(BuildStage.BUILD_INDEXES, generation.getFailedStage());
        assertEquals("disk full", generation.getErrorMessage());
        assertEquals(published, store.probe().getGenerationId());
    }

    @Test
    void testPruneBefore_KeepsNewerGenerations() {
        // Given
        long first = store.openGeneration();
        store.writeKpiValues(first, List.of(kpi("310001", "current_ratio", 1.0)));
        long second = store.openGeneration();
        store.writeKpiValues(second, List.of(kpi("310001", "current_ratio", 2.0)));
        long third = store.openGeneration();
        store.writeKpiValues(third, List.of(kpi("310001", "current_ratio", 3.0)));

        // When
        store.pruneBefore(second);

        // Then
        assertEquals(0, kpiValueRepository.countByGenerationId(first));
        assertEquals(1, kpiValueRepository.countByGenerationId(second));
        List<KpiValueEntity> newest = kpiValueRepository.findByGenerationId(third);
        assertEquals(3.0, newest.get(0).getKpiValue());
    }

    private static KpiValue kpi(String entityId, String kpiKey, Double value) {
        return KpiValue.builder()
                .entityId(entityId)
                .period(2024)
                .kpiKey(kpiKey)
                .value(value)
                .build();
    }

    private static BenchmarkStat stat(String kpiKey, String scope, String scopeKey, double value) {
        return BenchmarkStat.builder()
                .kpiKey(kpiKey)
                .scope(scope)
                .scopeKey(scopeKey)
                .period(2024)
                .p25(value)
                .median(value)
                .p75(value)
                .mean(value)
                .sampleCount(1)
                .build();
    }
}
