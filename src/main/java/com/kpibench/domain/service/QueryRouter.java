package com.kpibench.domain.service;

import com.kpibench.domain.catalog.KpiCatalog;
import com.kpibench.domain.catalog.KpiDefinition;
import com.kpibench.domain.exception.ComputationCancelledException;
import com.kpibench.domain.exception.RawFallbackTimeoutException;
import com.kpibench.domain.exception.StorageUnavailableException;
import com.kpibench.domain.model.AccessMode;
import com.kpibench.domain.model.BenchmarkQueryResponse;
import com.kpibench.domain.model.BenchmarkScope;
import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.EntityBenchmarkResponse;
import com.kpibench.domain.model.EntityListResponse;
import com.kpibench.domain.model.EntitySummary;
import com.kpibench.domain.model.EntityProfile;
import com.kpibench.domain.model.KpiHistoryResponse;
import com.kpibench.domain.model.KpiQueryResponse;
import com.kpibench.domain.model.QueryKind;
import com.kpibench.infrastructure.cache.ResultCache;
import com.kpibench.infrastructure.store.LineItemStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers KPI and benchmark queries from the best available source.
 *
 * Query Flow:
 * 1. Validate KPI key / scope id (unknown ones are client errors)
 * 2. Ask the capability detector for the mode of the query kind
 * 3. Check the result cache (keys carry the serving generation id)
 * 4. On a miss: PRECOMPUTED: point lookup in the published generation's index
 *    RAW_FALLBACK: scoped on-the-fly computation under a time limit
 *    UNAVAILABLE: explicit "no data"
 * 5. Cache the answer (positive TTL for data, negative TTL for absences)
 * 6. Return it tagged with its provenance
 *
 * Storage failures and fallback timeouts never surface to the caller: the
 * answer is UNAVAILABLE and the detector is asked to re-check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryRouter {

    private final KpiCatalog catalog;
    private final GenerationHolder generationHolder;
    private final CapabilityDetector capabilityDetector;
    private final RawFallbackService rawFallbackService;
    private final LineItemStore lineItemStore;
    private final ResultCache resultCache;
    private final MeterRegistry meterRegistry;

    @Value("${app.cache.ttl-seconds:300}")
    private long ttlSeconds = 300;

    @Value("${app.cache.negative-ttl-seconds:30}")
    private long negativeTtlSeconds = 30;

    /**
     * KPI values of one entity and period, in catalog order.
     */
    public KpiQueryResponse getKpis(String entityId, int period) {
        Timer.Sample sample = Timer.start(meterRegistry);
        AccessMode mode = capabilityDetector.currentMode(QueryKind.KPI_VALUES);
        Optional<GenerationIndex> index = generationHolder.current();
        Long generation = index.map(GenerationIndex::getGenerationId).orElse(null);

        String cacheKey = ResultCache.generateCacheKey("kpis", generation, entityId, period);
        Optional<KpiQueryResponse> cached = resultCache.get(cacheKey, KpiQueryResponse.class);
        if (cached.isPresent()) {
            recordCache("kpis", true);
            return cached.get().toBuilder().cached(true).build();
        }
        recordCache("kpis", false);

        long startTime = System.currentTimeMillis();
        Map<String, Double> values = Collections.emptyMap();
        try {
            switch (mode) {
                case PRECOMPUTED -> values = index
                        .filter(GenerationIndex::isKpiValuesReadable)
                        .flatMap(i -> i.kpis(entityId, period))
                        .orElse(Collections.emptyMap());
                case RAW_FALLBACK -> values = Collections.unmodifiableMap(
                        rawFallbackService.computeKpis(entityId, period));
                case UNAVAILABLE -> log.debug("KPI values unavailable for {}/{}", entityId, period);
            }
        } catch (StorageUnavailableException e) {
            log.warn("Storage failure serving KPIs {}/{}: {}", entityId, period, e.getMessage());
            capabilityDetector.markStale();
            mode = AccessMode.UNAVAILABLE;
        } catch (RawFallbackTimeoutException | ComputationCancelledException e) {
            log.warn("Raw fallback gave up on KPIs {}/{}: {}", entityId, period, e.getMessage());
            mode = AccessMode.UNAVAILABLE;
        }

        long queryTime = System.currentTimeMillis() - startTime;
        KpiQueryResponse response = KpiQueryResponse.builder()
                .entityId(entityId)
                .period(period)
                .values(values)
                .provenance(mode)
                .dataAvailable(!values.isEmpty())
                .generation(generation)
                .cached(false)
                .queryTimeMs(queryTime)
                .build();
        resultCache.put(cacheKey, response, ttlFor(response.isDataAvailable()));

        recordExecuted(sample, "kpis", mode);
        log.info("KPI query executed: {}/{} via {}, {} values, {} ms", entityId, period, mode, values.size(), queryTime);
        return response;
    }

    /**
     * KPI values of one entity across every period it has rows for, oldest first.
     */
    public KpiHistoryResponse getKpiHistory(String entityId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        AccessMode mode = capabilityDetector.currentMode(QueryKind.KPI_VALUES);
        Optional<GenerationIndex> index = generationHolder.current();
        Long generation = index.map(GenerationIndex::getGenerationId).orElse(null);

        String cacheKey = ResultCache.generateCacheKey("kpi-history", generation, entityId);
        Optional<KpiHistoryResponse> cached = resultCache.get(cacheKey, KpiHistoryResponse.class);
        if (cached.isPresent()) {
            recordCache("kpi-history", true);
            return cached.get().toBuilder().cached(true).build();
        }
        recordCache("kpi-history", false);

        long startTime = System.currentTimeMillis();
        Map<Integer, Map<String, Double>> periods = Collections.emptyMap();
        try {
            switch (mode) {
                case PRECOMPUTED -> periods = index
                        .filter(GenerationIndex::isKpiValuesReadable)
                        .<Map<Integer, Map<String, Double>>>map(i -> i.history(entityId))
                        .orElse(Collections.emptyMap());
                case RAW_FALLBACK -> periods = Collections.unmodifiableMap(
                        rawFallbackService.computeKpiHistory(entityId));
                case UNAVAILABLE -> log.debug("KPI history unavailable for {}", entityId);
            }
        } catch (StorageUnavailableException e) {
            log.warn("Storage failure serving KPI history of {}: {}", entityId, e.getMessage());
            capabilityDetector.markStale();
            mode = AccessMode.UNAVAILABLE;
        } catch (RawFallbackTimeoutException | ComputationCancelledException e) {
            log.warn("Raw fallback gave up on KPI history of {}: {}", entityId, e.getMessage());
            mode = AccessMode.UNAVAILABLE;
        }

        long queryTime = System.currentTimeMillis() - startTime;
        KpiHistoryResponse response = KpiHistoryResponse.builder()
                .entityId(entityId)
                .periods(periods)
                .provenance(mode)
                .dataAvailable(!periods.isEmpty())
                .generation(generation)
                .cached(false)
                .queryTimeMs(queryTime)
                .build();
        resultCache.put(cacheKey, response, ttlFor(response.isDataAvailable()));

        recordExecuted(sample, "kpi-history", mode);
        log.info("KPI history query executed: {} via {}, {} periods, {} ms", entityId, mode, periods.size(), queryTime);
        return response;
    }

    /**
     * Every entity that reports line-items, with region and reported period span.
     *
     * Always read from the line-item store; a storage failure yields an
     * empty, negatively cached answer.
     */
    public EntityListResponse listEntities() {
        Long generation = generationHolder.currentGenerationId().orElse(null);
        String cacheKey = ResultCache.generateCacheKey("entities", generation);
        Optional<EntityListResponse> cached = resultCache.get(cacheKey, EntityListResponse.class);
        if (cached.isPresent()) {
            recordCache("entities", true);
            return cached.get().toBuilder().cached(true).build();
        }
        recordCache("entities", false);

        long startTime = System.currentTimeMillis();
        List<EntitySummary> entities;
        boolean dataAvailable;
        try {
            entities = List.copyOf(lineItemStore.entities());
            dataAvailable = true;
        } catch (StorageUnavailableException e) {
            log.warn("Cannot list entities: {}", e.getMessage());
            capabilityDetector.markStale();
            entities = List.of();
            dataAvailable = false;
        }

        long queryTime = System.currentTimeMillis() - startTime;
        EntityListResponse response = EntityListResponse.builder()
                .entities(entities)
                .dataAvailable(dataAvailable)
                .generation(generation)
                .cached(false)
                .queryTimeMs(queryTime)
                .build();
        resultCache.put(cacheKey, response, ttlFor(dataAvailable));
        log.info("Entity list served: {} entities, {} ms", entities.size(), queryTime);
        return response;
    }

    /**
     * Benchmark of one KPI for one peer-group partition.
     *
     * @throws IllegalArgumentException for an unknown KPI key or scope id
     */
    public BenchmarkQueryResponse getBenchmarks(String kpiKey, String scopeId, String scopeKey, int period) {
        catalog.requireDefinition(kpiKey);
        BenchmarkScope scope = catalog.requireScope(scopeId);
        if (scopeKey == null || scopeKey.isBlank()) {
            throw new IllegalArgumentException("Scope key is required");
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        AccessMode mode = capabilityDetector.currentMode(QueryKind.BENCHMARKS);
        Optional<GenerationIndex> index = generationHolder.current();
        Long generation = index.map(GenerationIndex::getGenerationId).orElse(null);

        String cacheKey = ResultCache.generateCacheKey("benchmarks", generation, kpiKey, scopeId, scopeKey, period);
        Optional<BenchmarkQueryResponse> cached = resultCache.get(cacheKey, BenchmarkQueryResponse.class);
        if (cached.isPresent()) {
            recordCache("benchmarks", true);
            return cached.get().toBuilder().cached(true).build();
        }
        recordCache("benchmarks", false);

        long startTime = System.currentTimeMillis();
        BenchmarkStat stat = null;
        try {
            switch (mode) {
                case PRECOMPUTED -> stat = index
                        .filter(GenerationIndex::isBenchmarkStatsReadable)
                        .flatMap(i -> i.benchmark(kpiKey, scopeId, scopeKey, period))
                        .orElse(null);
                case RAW_FALLBACK -> stat = rawFallbackService
                        .computeBenchmark(kpiKey, scope, scopeKey, period)
                        .orElse(null);
                case UNAVAILABLE -> log.debug("Benchmarks unavailable for {}/{}/{}", kpiKey, scopeId, scopeKey);
            }
        } catch (StorageUnavailableException e) {
            log.warn("Storage failure serving benchmark {}/{}/{}: {}", kpiKey, scopeId, scopeKey, e.getMessage());
            capabilityDetector.markStale();
            mode = AccessMode.UNAVAILABLE;
        } catch (RawFallbackTimeoutException | ComputationCancelledException e) {
            log.warn("Raw fallback gave up on benchmark {}/{}/{}: {}", kpiKey, scopeId, scopeKey, e.getMessage());
            mode = AccessMode.UNAVAILABLE;
        }

        long queryTime = System.currentTimeMillis() - startTime;
        BenchmarkQueryResponse response = BenchmarkQueryResponse.builder()
                .kpiKey(kpiKey)
                .scope(scopeId)
                .scopeKey(scopeKey)
                .period(period)
                .stat(stat)
                .provenance(mode)
                .generation(generation)
                .cached(false)
                .queryTimeMs(queryTime)
                .build();
        resultCache.put(cacheKey, response, ttlFor(response.isPresent()));

        recordExecuted(sample, "benchmarks", mode);
        log.info("Benchmark query executed: {}/{}/{}/{} via {}, {} ms", kpiKey, scopeId, scopeKey, period, mode, queryTime);
        return response;
    }

    /**
     * Benchmarks of every KPI for the partition the entity falls in.
     *
     * The provenance is the weakest source any single KPI was served from.
     *
     * @throws IllegalArgumentException for an unknown scope id
     */
    public EntityBenchmarkResponse getEntityBenchmarks(String entityId, int period, String scopeId) {
        BenchmarkScope scope = catalog.requireScope(scopeId);

        Optional<EntityProfile> profile;
        try {
            profile = lineItemStore.profile(entityId);
        } catch (StorageUnavailableException e) {
            log.warn("Cannot resolve profile of {}: {}", entityId, e.getMessage());
            capabilityDetector.markStale();
            return EntityBenchmarkResponse.builder()
                    .entityId(entityId)
                    .period(period)
                    .scope(scopeId)
                    .benchmarks(Collections.emptyMap())
                    .provenance(AccessMode.UNAVAILABLE)
                    .build();
        }

        Optional<String> scopeKey = scope.scopeKeyFor(profile.orElse(null));
        if (scopeKey.isEmpty()) {
            log.debug("Entity {} has no partition in scope {}", entityId, scopeId);
            return EntityBenchmarkResponse.builder()
                    .entityId(entityId)
                    .period(period)
                    .scope(scopeId)
                    .benchmarks(Collections.emptyMap())
                    .provenance(capabilityDetector.currentMode(QueryKind.BENCHMARKS))
                    .build();
        }

        Map<String, BenchmarkStat> benchmarks = new LinkedHashMap<>();
        AccessMode provenance = AccessMode.PRECOMPUTED;
        for (KpiDefinition definition : catalog.definitions()) {
            BenchmarkQueryResponse response = getBenchmarks(definition.getKey(), scopeId, scopeKey.get(), period);
            benchmarks.put(definition.getKey(), response.getStat());
            if (response.getProvenance().ordinal() > provenance.ordinal()) {
                provenance = response.getProvenance();
            }
        }
        return EntityBenchmarkResponse.builder()
                .entityId(entityId)
                .period(period)
                .scope(scopeId)
                .scopeKey(scopeKey.get())
                .benchmarks(benchmarks)
                .provenance(provenance)
                .build();
    }

    private Duration ttlFor(boolean hasData) {
        return Duration.ofSeconds(hasData ? ttlSeconds : negativeTtlSeconds);
    }

    private void recordCache(String type, boolean hit) {
        Counter.builder("query.cache")
                .tag("result", hit ? "hit" : "miss")
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    private void recordExecuted(Timer.Sample sample, String type, AccessMode mode) {
        sample.stop(Timer.builder("query.latency")
                .tag("type", type)
                .tag("cached", "false")
                .register(meterRegistry));

        Counter.builder("query.executed")
                .tag("type", type)
                .tag("provenance", mode.name())
                .register(meterRegistry)
                .increment();
    }
}
