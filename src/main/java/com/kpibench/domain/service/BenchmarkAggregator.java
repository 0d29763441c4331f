package com.kpibench.domain.service;

import com.kpibench.domain.exception.ComputationCancelledException;
import com.kpibench.domain.model.BenchmarkScope;
import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.EntityProfile;
import com.kpibench.domain.model.KpiValue;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Peer-group percentile statistics.
 *
 * Values are grouped by scope key in a single pass, then each group is sorted
 * once and p25, median, p75 and mean are all read from that sorted array.
 * Null KPI values and entities outside the scope are skipped; groups left
 * without samples produce no stat at all.
 */
@Component
public class BenchmarkAggregator {

    /**
     * @param values   KPI values of any entities; only non-null values of
     *                 {@code kpiKey} in {@code period} are used
     * @param profiles entity profiles by entity id
     * @return stats by scope key, sorted by key
     */
    public Map<String, BenchmarkStat> aggregate(String kpiKey, BenchmarkScope scope, int period,
                                                Collection<KpiValue> values,
                                                Map<String, EntityProfile> profiles) {
        Map<String, DoubleBuffer> groups = new TreeMap<>();
        for (KpiValue value : values) {
            if (!value.hasValue() || value.getPeriod() != period || !kpiKey.equals(value.getKpiKey())) {
                continue;
            }
            Optional<String> scopeKey = scope.scopeKeyFor(profiles.get(value.getEntityId()));
            if (scopeKey.isEmpty()) {
                continue;
            }
            groups.computeIfAbsent(scopeKey.get(), k -> new DoubleBuffer()).add(value.getValue());
        }

        Map<String, BenchmarkStat> stats = new TreeMap<>();
        for (Map.Entry<String, DoubleBuffer> group : groups.entrySet()) {
            ComputationCancelledException.checkpoint("percentile sort");
            double[] sample = group.getValue().toSortedArray();
            stats.put(group.getKey(), toStat(kpiKey, scope.getId(), group.getKey(), period, sample));
        }
        return stats;
    }

    static BenchmarkStat toStat(String kpiKey, String scope, String scopeKey, int period, double[] sorted) {
        return BenchmarkStat.builder()
                .kpiKey(kpiKey)
                .scope(scope)
                .scopeKey(scopeKey)
                .period(period)
                .p25(Percentiles.continuous(sorted, 0.25))
                .median(Percentiles.continuous(sorted, 0.50))
                .p75(Percentiles.continuous(sorted, 0.75))
                .mean(Percentiles.mean(sorted))
                .sampleCount(sorted.length)
                .build();
    }

    // Growable primitive buffer; avoids boxing on large scopes
    private static final class DoubleBuffer {
        private double[] data = new double[16];
        private int size;

        void add(double value) {
            if (size == data.length) {
                data = Arrays.copyOf(data, size * 2);
            }
            data[size++] = value;
        }

        double[] toSortedArray() {
            double[] sorted = Arrays.copyOf(data, size);
            Arrays.sort(sorted);
            return sorted;
        }
    }
}
