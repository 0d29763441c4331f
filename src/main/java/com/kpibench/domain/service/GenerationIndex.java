package com.kpibench.domain.service;

import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.KpiValue;
import lombok.Getter;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable point-lookup index over one published generation.
 *
 * A table that failed its presence check is indexed as unreadable; lookups
 * against it are not answered and the detector routes that query kind
 * elsewhere.
 */
@Getter
public final class GenerationIndex {

    private final long generationId;
    private final boolean kpiValuesReadable;
    private final boolean benchmarkStatsReadable;
    private final long kpiValueCount;
    private final long benchmarkStatCount;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<EntityPeriod, Map<String, Double>> kpis;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, SortedMap<Integer, Map<String, Double>>> histories;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<BenchmarkKey, BenchmarkStat> benchmarks;

    private GenerationIndex(long generationId,
                            Map<EntityPeriod, Map<String, Double>> kpis, boolean kpiValuesReadable, long kpiValueCount,
                            Map<BenchmarkKey, BenchmarkStat> benchmarks, boolean benchmarkStatsReadable) {
        this.generationId = generationId;
        this.kpis = kpis;
        this.histories = new HashMap<>();
        for (Map.Entry<EntityPeriod, Map<String, Double>> entry : kpis.entrySet()) {
            histories.computeIfAbsent(entry.getKey().getEntityId(), k -> new TreeMap<>())
                    .put(entry.getKey().getPeriod(), entry.getValue());
        }
        this.kpiValuesReadable = kpiValuesReadable;
        this.kpiValueCount = kpiValueCount;
        this.benchmarks = benchmarks;
        this.benchmarkStatsReadable = benchmarkStatsReadable;
        this.benchmarkStatCount = benchmarks.size();
    }

    /**
     * @param kpiValues null when the KPI table could not be read
     * @param stats     null when the benchmark table could not be read
     * @param kpiOrder  catalog order used for every entity's value map
     */
    public static GenerationIndex of(long generationId, Collection<KpiValue> kpiValues,
                                     Collection<BenchmarkStat> stats, List<String> kpiOrder) {
        Map<EntityPeriod, Map<String, Double>> kpis = new HashMap<>();
        if (kpiValues != null) {
            Map<EntityPeriod, Map<String, Double>> unordered = new HashMap<>();
            for (KpiValue value : kpiValues) {
                unordered.computeIfAbsent(new EntityPeriod(value.getEntityId(), value.getPeriod()),
                        k -> new HashMap<>()).put(value.getKpiKey(), value.getValue());
            }
            for (Map.Entry<EntityPeriod, Map<String, Double>> entry : unordered.entrySet()) {
                Map<String, Double> ordered = new LinkedHashMap<>();
                for (String key : kpiOrder) {
                    if (entry.getValue().containsKey(key)) {
                        ordered.put(key, entry.getValue().get(key));
                    }
                }
                kpis.put(entry.getKey(), Collections.unmodifiableMap(ordered));
            }
        }

        Map<BenchmarkKey, BenchmarkStat> benchmarks = new HashMap<>();
        if (stats != null) {
            for (BenchmarkStat stat : stats) {
                benchmarks.put(new BenchmarkKey(stat.getKpiKey(), stat.getScope(), stat.getScopeKey(), stat.getPeriod()), stat);
            }
        }
        return new GenerationIndex(generationId,
                kpis, kpiValues != null, kpiValues == null ? 0 : kpiValues.size(),
                benchmarks, stats != null);
    }

    /**
     * @return empty when the generation holds no rows for the entity and period
     */
    public Optional<Map<String, Double>> kpis(String entityId, int period) {
        return Optional.ofNullable(kpis.get(new EntityPeriod(entityId, period)));
    }

    /**
     * Every period the generation holds KPI rows for, oldest first.
     *
     * @return an empty map when the entity has no rows
     */
    public SortedMap<Integer, Map<String, Double>> history(String entityId) {
        SortedMap<Integer, Map<String, Double>> history = histories.get(entityId);
        return history == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(history);
    }

    public Optional<BenchmarkStat> benchmark(String kpiKey, String scope, String scopeKey, int period) {
        return Optional.ofNullable(benchmarks.get(new BenchmarkKey(kpiKey, scope, scopeKey, period)));
    }

    @Value
    private static class EntityPeriod {
        String entityId;
        int period;
    }

    @Value
    private static class BenchmarkKey {
        String kpiKey;
        String scope;
        String scopeKey;
        int period;
    }
}
