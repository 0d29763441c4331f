package com.kpibench.domain.service;

import com.kpibench.domain.catalog.KpiCatalog;
import com.kpibench.domain.catalog.KpiDefinition;
import com.kpibench.domain.exception.ComputationCancelledException;
import com.kpibench.domain.exception.RawFallbackTimeoutException;
import com.kpibench.domain.model.BenchmarkScope;
import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.EntityProfile;
import com.kpibench.domain.model.KpiValue;
import com.kpibench.domain.model.LineItem;
import com.kpibench.infrastructure.store.LineItemStore;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Computes answers straight from line-items when no precomputed table can serve.
 *
 * Each request runs on the fallback pool under a time limit. When the limit is
 * hit the worker is interrupted and stops at its next stage boundary (line-item
 * load, aggregate resolution, percentile sort).
 *
 * Only the rows a request needs are loaded: the entity's current and previous
 * period for KPI values, and the period's rows of the scope partition's
 * members for a benchmark.
 */
@Slf4j
@Service
public class RawFallbackService {

    private final LineItemStore lineItemStore;
    private final KpiCalculator kpiCalculator;
    private final BenchmarkAggregator benchmarkAggregator;
    private final KpiCatalog catalog;
    private final ThreadPoolTaskExecutor fallbackExecutor;
    private final TimeLimiter fallbackTimeLimiter;

    public RawFallbackService(LineItemStore lineItemStore,
                              KpiCalculator kpiCalculator,
                              BenchmarkAggregator benchmarkAggregator,
                              KpiCatalog catalog,
                              @Qualifier("fallbackExecutor") ThreadPoolTaskExecutor fallbackExecutor,
                              TimeLimiter fallbackTimeLimiter) {
        this.lineItemStore = lineItemStore;
        this.kpiCalculator = kpiCalculator;
        this.benchmarkAggregator = benchmarkAggregator;
        this.catalog = catalog;
        this.fallbackExecutor = fallbackExecutor;
        this.fallbackTimeLimiter = fallbackTimeLimiter;
    }

    /**
     * @return KPI values in catalog order; empty when the entity has no
     * line-items in the period
     */
    public Map<String, Double> computeKpis(String entityId, int period) {
        return callWithTimeLimit("kpis " + entityId + "/" + period, () -> {
            List<LineItem> items = lineItemStore.findByEntity(entityId, List.of(period, period - 1));
            ComputationCancelledException.checkpoint("line-item load");
            return kpiCalculator.computeAll(entityId, period, items);
        });
    }

    /**
     * KPI values of every period the entity reported, oldest first.
     *
     * @return empty when the entity has no line-items
     */
    public SortedMap<Integer, Map<String, Double>> computeKpiHistory(String entityId) {
        return callWithTimeLimit("kpi history " + entityId, () -> {
            List<LineItem> items = lineItemStore.findByEntity(entityId, lineItemStore.periods());
            ComputationCancelledException.checkpoint("line-item load");

            Map<Integer, List<LineItem>> byPeriod = new TreeMap<>();
            for (LineItem item : items) {
                byPeriod.computeIfAbsent(item.getPeriod(), k -> new ArrayList<>()).add(item);
            }
            SortedMap<Integer, Map<String, Double>> history = new TreeMap<>();
            for (Map.Entry<Integer, List<LineItem>> entry : byPeriod.entrySet()) {
                int period = entry.getKey();
                List<LineItem> periodItems = new ArrayList<>(entry.getValue());
                periodItems.addAll(byPeriod.getOrDefault(period - 1, List.of()));
                Map<String, Double> values = kpiCalculator.computeAll(entityId, period, periodItems);
                if (!values.isEmpty()) {
                    history.put(period, Collections.unmodifiableMap(values));
                }
                ComputationCancelledException.checkpoint("kpi history period " + period);
            }
            return history;
        });
    }

    /**
     * @return the stat of the requested partition, empty when it has no samples
     */
    public Optional<BenchmarkStat> computeBenchmark(String kpiKey, BenchmarkScope scope, String scopeKey, int period) {
        return callWithTimeLimit("benchmark " + kpiKey + "/" + scope.getId() + "/" + scopeKey + "/" + period, () -> {
            KpiDefinition definition = catalog.requireDefinition(kpiKey);
            Map<String, EntityProfile> profiles = lineItemStore.profiles();
            List<LineItem> items;
            if (scope.getDimensions().isEmpty()) {
                items = new ArrayList<>(lineItemStore.findByPeriod(period));
                items.addAll(lineItemStore.findByPeriod(period - 1));
            } else {
                List<String> members = profiles.values().stream()
                        .filter(profile -> scope.scopeKeyFor(profile).map(scopeKey::equals).orElse(false))
                        .map(EntityProfile::getEntityId)
                        .sorted()
                        .toList();
                if (members.isEmpty()) {
                    return Optional.<BenchmarkStat>empty();
                }
                items = lineItemStore.findByEntities(members, List.of(period, period - 1));
            }
            ComputationCancelledException.checkpoint("line-item load");

            List<KpiValue> values = new ArrayList<>();
            for (Map.Entry<String, List<LineItem>> entry : groupByEntity(items).entrySet()) {
                List<LineItem> entityItems = entry.getValue();
                // only entities reporting in the period itself are benchmarked
                if (entityItems.stream().noneMatch(item -> item.getPeriod() == period)) {
                    continue;
                }
                Double value = kpiCalculator.compute(entry.getKey(), period, definition, entityItems).value();
                values.add(KpiValue.builder()
                        .entityId(entry.getKey())
                        .period(period)
                        .kpiKey(kpiKey)
                        .value(value)
                        .build());
            }
            return Optional.ofNullable(benchmarkAggregator
                    .aggregate(kpiKey, scope, period, values, profiles)
                    .get(scopeKey));
        });
    }

    private <T> T callWithTimeLimit(String request, Callable<T> task) {
        try {
            return fallbackTimeLimiter.executeFutureSupplier(() -> fallbackExecutor.submit(task));
        } catch (TimeoutException e) {
            log.warn("Raw fallback timed out: {}", request);
            throw new RawFallbackTimeoutException("Raw fallback timed out for " + request, e);
        } catch (TaskRejectedException e) {
            log.warn("Raw fallback pool saturated, rejecting {}", request);
            throw new RawFallbackTimeoutException("Raw fallback pool saturated for " + request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationCancelledException("raw fallback wait");
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Raw fallback failed for " + request, e);
        }
    }

    private static Map<String, List<LineItem>> groupByEntity(List<LineItem> items) {
        Map<String, List<LineItem>> byEntity = new TreeMap<>();
        for (LineItem item : items) {
            byEntity.computeIfAbsent(item.getEntityId(), k -> new ArrayList<>()).add(item);
        }
        return byEntity;
    }
}
