package com.kpibench.infrastructure.store;

import com.kpibench.domain.exception.StorageUnavailableException;
import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.BuildStage;
import com.kpibench.domain.model.KpiValue;
import com.kpibench.infrastructure.persistence.entity.BenchmarkStatEntity;
import com.kpibench.infrastructure.persistence.entity.BuildGenerationEntity;
import com.kpibench.infrastructure.persistence.entity.KpiValueEntity;
import com.kpibench.infrastructure.persistence.entity.PublishedGenerationEntity;
import com.kpibench.infrastructure.persistence.repository.BenchmarkStatRepository;
import com.kpibench.infrastructure.persistence.repository.BuildGenerationRepository;
import com.kpibench.infrastructure.persistence.repository.KpiValueRepository;
import com.kpibench.infrastructure.persistence.repository.PublishedGenerationRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Generation persistence on the kpi_values / benchmark_stats tables.
 *
 * Publish Flow:
 * 1. openGeneration() records a RUNNING build_generations row
 * 2. rows are written tagged with that generation id (invisible to readers)
 * 3. publish() marks the generation PUBLISHED and moves the marker, in one transaction
 * 4. generations older than the previous one are pruned afterwards
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaPrecomputedStore implements PrecomputedStore {

    private final BuildGenerationRepository buildGenerationRepository;
    private final PublishedGenerationRepository publishedGenerationRepository;
    private final KpiValueRepository kpiValueRepository;
    private final BenchmarkStatRepository benchmarkStatRepository;

    @Override
    @Transactional
    public long openGeneration() {
        BuildGenerationEntity generation = new BuildGenerationEntity();
        generation.markStarted();
        generation = buildGenerationRepository.save(generation);
        return generation.getGenerationId();
    }

    @Override
    @Transactional
    public void writeKpiValues(long generationId, List<KpiValue> values) {
        List<KpiValueEntity> rows = values.stream()
                .map(v -> KpiValueEntity.builder()
                        .generationId(generationId)
                        .entityId(v.getEntityId())
                        .period(v.getPeriod())
                        .kpiKey(v.getKpiKey())
                        .kpiValue(v.getValue())
                        .build())
                .toList();
        kpiValueRepository.saveAll(rows);
    }

    @Override
    @Transactional
    public void writeBenchmarkStats(long generationId, List<BenchmarkStat> stats) {
        List<BenchmarkStatEntity> rows = stats.stream()
                .map(s -> BenchmarkStatEntity.builder()
                        .generationId(generationId)
                        .kpiKey(s.getKpiKey())
                        .scopeId(s.getScope())
                        .scopeKey(s.getScopeKey())
                        .period(s.getPeriod())
                        .p25(s.getP25())
                        .median(s.getMedian())
                        .p75(s.getP75())
                        .mean(s.getMean())
                        .sampleCount(s.getSampleCount())
                        .build())
                .toList();
        benchmarkStatRepository.saveAll(rows);
    }

    @Override
    @Transactional
    public void publish(long generationId, long kpiValueCount, long benchmarkStatCount) {
        BuildGenerationEntity generation = buildGenerationRepository.findById(generationId)
                .orElseThrow(() -> new IllegalStateException("Unknown generation: " + generationId));
        generation.markPublished(kpiValueCount, benchmarkStatCount);
        buildGenerationRepository.save(generation);

        publishedGenerationRepository.save(PublishedGenerationEntity.builder()
                .markerId(PublishedGenerationEntity.CURRENT)
                .generationId(generationId)
                .publishedAt(Instant.now())
                .build());

        log.info("Generation {} published ({} KPI values, {} benchmark stats)",
                generationId, kpiValueCount, benchmarkStatCount);
    }

    @Override
    @Transactional
    public void discard(long generationId, BuildStage stage, String subject, String message) {
        int kpiRows = kpiValueRepository.deleteByGeneration(generationId);
        int statRows = benchmarkStatRepository.deleteByGeneration(generationId);
        buildGenerationRepository.findById(generationId).ifPresent(generation -> {
            generation.markFailed(stage, subject, message);
            buildGenerationRepository.save(generation);
        });
        log.warn("Generation {} discarded after failure in {} ({} KPI rows, {} stat rows removed)",
                generationId, stage, kpiRows, statRows);
    }

    @Override
    @Transactional
    public void pruneBefore(long generationId) {
        int kpiRows = kpiValueRepository.deleteOlderThan(generationId);
        int statRows = benchmarkStatRepository.deleteOlderThan(generationId);
        if (kpiRows + statRows > 0) {
            log.info("Pruned generations before {} ({} KPI rows, {} stat rows)", generationId, kpiRows, statRows);
        }
    }

    // No surrounding transaction: each table is checked on its own so one
    // unreadable table cannot poison the other's check.
    @Override
    @CircuitBreaker(name = "precomputedStore", fallbackMethod = "probeFallback")
    public GenerationProbe probe() {
        Optional<PublishedGenerationEntity> marker = publishedGenerationRepository.findById(PublishedGenerationEntity.CURRENT);
        if (marker.isEmpty()) {
            return GenerationProbe.none();
        }
        Long generationId = marker.get().getGenerationId();
        Optional<BuildGenerationEntity> generation = buildGenerationRepository.findById(generationId)
                .filter(g -> g.getStatus() == BuildGenerationEntity.Status.PUBLISHED);
        if (generation.isEmpty()) {
            log.warn("Marker names generation {} which is not PUBLISHED", generationId);
            return GenerationProbe.none();
        }
        boolean kpiReadable = tableMatches("kpi_values", generation.get().getKpiValueCount(),
                () -> kpiValueRepository.countByGenerationId(generationId));
        boolean statsReadable = tableMatches("benchmark_stats", generation.get().getBenchmarkStatCount(),
                () -> benchmarkStatRepository.countByGenerationId(generationId));
        return new GenerationProbe(generationId, kpiReadable, statsReadable);
    }

    @Override
    @Transactional(readOnly = true)
    public List<KpiValue> loadKpiValues(long generationId) {
        try {
            return kpiValueRepository.findByGenerationId(generationId).stream()
                    .map(row -> KpiValue.builder()
                            .entityId(row.getEntityId())
                            .period(row.getPeriod())
                            .kpiKey(row.getKpiKey())
                            .value(row.getKpiValue())
                            .build())
                    .toList();
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Cannot read kpi_values of generation " + generationId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<BenchmarkStat> loadBenchmarkStats(long generationId) {
        try {
            return benchmarkStatRepository.findByGenerationId(generationId).stream()
                    .map(row -> BenchmarkStat.builder()
                            .kpiKey(row.getKpiKey())
                            .scope(row.getScopeId())
                            .scopeKey(row.getScopeKey())
                            .period(row.getPeriod())
                            .p25(row.getP25())
                            .median(row.getMedian())
                            .p75(row.getP75())
                            .mean(row.getMean())
                            .sampleCount(row.getSampleCount())
                            .build())
                    .toList();
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Cannot read benchmark_stats of generation " + generationId, e);
        }
    }

    private boolean tableMatches(String table, long expected, RowCounter counter) {
        try {
            long actual = counter.count();
            if (actual != expected) {
                log.warn("Table {} holds {} rows for the published generation, expected {}", table, actual, expected);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            log.warn("Table {} unreadable: {}", table, e.getMessage());
            return false;
        }
    }

    private GenerationProbe probeFallback(Exception e) {
        throw new StorageUnavailableException("Precomputed store unavailable", e);
    }

    @FunctionalInterface
    private interface RowCounter {
        long count();
    }
}
