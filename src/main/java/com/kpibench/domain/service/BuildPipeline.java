package com.kpibench.domain.service;

import com.kpibench.domain.catalog.KpiCatalog;
import com.kpibench.domain.catalog.KpiDefinition;
import com.kpibench.domain.exception.BuildFailureException;
import com.kpibench.domain.model.BenchmarkScope;
import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.BuildReport;
import com.kpibench.domain.model.BuildStage;
import com.kpibench.domain.model.EntityProfile;
import com.kpibench.domain.model.KpiValue;
import com.kpibench.domain.model.LineItem;
import com.kpibench.infrastructure.store.LineItemStore;
import com.kpibench.infrastructure.store.PrecomputedStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Offline precomputation of KPI values and benchmark stats.
 *
 * Stages (strictly ordered):
 * 1. LOAD - periods, entity profiles and every period's line-items
 * 2. COMPUTE_KPIS - every catalog KPI per entity and period, one task per entity
 * 3. COMPUTE_BENCHMARKS - stats of every period, one task per KPI x scope
 * 4. BUILD_INDEXES - rows written under the new generation, in-memory index built
 * 5. PUBLISH - marker moved, index swapped in, readers see the new generation
 *
 * Any failure discards the generation's rows and leaves the previous
 * generation serving. Output order is fixed (entity, period, catalog order;
 * KPI, scope, period, scope key) so reruns on unchanged input store
 * identical content.
 *
 * Only one build runs at a time.
 */
@Slf4j
@Service
public class BuildPipeline {

    private final LineItemStore lineItemStore;
    private final PrecomputedStore precomputedStore;
    private final KpiCatalog catalog;
    private final KpiCalculator kpiCalculator;
    private final BenchmarkAggregator benchmarkAggregator;
    private final GenerationHolder generationHolder;
    private final CapabilityDetector capabilityDetector;
    private final ThreadPoolTaskExecutor buildWorkerExecutor;
    private final MeterRegistry meterRegistry;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Value("${app.build.write-chunk-size:5000}")
    private int writeChunkSize = 5000;

    public BuildPipeline(LineItemStore lineItemStore,
                         PrecomputedStore precomputedStore,
                         KpiCatalog catalog,
                         KpiCalculator kpiCalculator,
                         BenchmarkAggregator benchmarkAggregator,
                         GenerationHolder generationHolder,
                         CapabilityDetector capabilityDetector,
                         @Qualifier("buildWorkerExecutor") ThreadPoolTaskExecutor buildWorkerExecutor,
                         MeterRegistry meterRegistry) {
        this.lineItemStore = lineItemStore;
        this.precomputedStore = precomputedStore;
        this.catalog = catalog;
        this.kpiCalculator = kpiCalculator;
        this.benchmarkAggregator = benchmarkAggregator;
        this.generationHolder = generationHolder;
        this.capabilityDetector = capabilityDetector;
        this.buildWorkerExecutor = buildWorkerExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a complete build on the calling thread.
     *
     * @return the report; failures are reported, not thrown
     * @throws BuildFailureException when another build is already running
     */
    public BuildReport build() {
        long generationId;
        try {
            generationId = begin();
        } catch (BuildFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Could not open a new generation: {}", e.getMessage(), e);
            return BuildReport.builder()
                    .succeeded(false)
                    .failedStage(BuildStage.LOAD)
                    .message(e.getMessage())
                    .build();
        }
        return run(generationId);
    }

    /**
     * Claim the single build slot and record a new running generation.
     *
     * The caller must hand the returned id to {@link #run(long)}, which
     * releases the slot.
     *
     * @throws BuildFailureException when another build is already running
     */
    public long begin() {
        if (!running.compareAndSet(false, true)) {
            throw new BuildFailureException(null, null, "A build is already running");
        }
        try {
            long generationId = precomputedStore.openGeneration();
            log.info("Build started: generation {}", generationId);
            return generationId;
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
    }

    /**
     * Run every stage for a generation opened by {@link #begin()}.
     */
    public BuildReport run(long generationId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        BuildStage stage = BuildStage.LOAD;
        try {
            Map<String, EntityProfile> profiles = lineItemStore.profiles();
            List<Integer> periods = lineItemStore.periods().stream().sorted().toList();
            Map<String, Map<Integer, List<LineItem>>> itemsByEntity = loadLineItems(periods);
            log.info("Loaded {} entities over {} periods", itemsByEntity.size(), periods.size());

            stage = BuildStage.COMPUTE_KPIS;
            List<KpiValue> kpiValues = computeKpis(itemsByEntity);

            stage = BuildStage.COMPUTE_BENCHMARKS;
            List<BenchmarkStat> stats = computeBenchmarks(kpiValues, periods, profiles);

            stage = BuildStage.BUILD_INDEXES;
            writeChunked(generationId, kpiValues, stats);
            GenerationIndex index = GenerationIndex.of(generationId, kpiValues, stats, kpiOrder());

            stage = BuildStage.PUBLISH;
            Long previousGeneration = generationHolder.currentGenerationId().orElse(null);
            precomputedStore.publish(generationId, kpiValues.size(), stats.size());
            generationHolder.publish(index);
            capabilityDetector.detect();
            prune(previousGeneration);

            long elapsed = System.currentTimeMillis() - startTime;
            recordRun(sample, true);
            log.info("Build completed: generation {} ({} KPI values, {} benchmark stats, {} ms)",
                    generationId, kpiValues.size(), stats.size(), elapsed);
            return BuildReport.builder()
                    .generationId(generationId)
                    .succeeded(true)
                    .kpiValueCount(kpiValues.size())
                    .benchmarkStatCount(stats.size())
                    .elapsedMs(elapsed)
                    .build();

        } catch (BuildFailureException e) {
            return fail(generationId, e.getStage() != null ? e.getStage() : stage, e.getSubject(), e, sample, startTime);
        } catch (RuntimeException e) {
            return fail(generationId, stage, null, e, sample, startTime);
        } finally {
            running.set(false);
        }
    }

    /**
     * Give up a generation opened by {@link #begin()} that will never run.
     */
    public void abandon(long generationId, String reason) {
        try {
            precomputedStore.discard(generationId, BuildStage.LOAD, null, reason);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private Map<String, Map<Integer, List<LineItem>>> loadLineItems(List<Integer> periods) {
        Map<String, Map<Integer, List<LineItem>>> itemsByEntity = new TreeMap<>();
        for (Integer period : periods) {
            for (LineItem item : lineItemStore.findByPeriod(period)) {
                itemsByEntity
                        .computeIfAbsent(item.getEntityId(), k -> new TreeMap<>())
                        .computeIfAbsent(item.getPeriod(), k -> new ArrayList<>())
                        .add(item);
            }
        }
        return itemsByEntity;
    }

    private List<KpiValue> computeKpis(Map<String, Map<Integer, List<LineItem>>> itemsByEntity) {
        Map<String, Callable<List<KpiValue>>> tasks = new LinkedHashMap<>();
        itemsByEntity.forEach((entityId, byPeriod) -> tasks.put(entityId, () -> computeEntity(entityId, byPeriod)));
        List<KpiValue> values = new ArrayList<>();
        runParallel(BuildStage.COMPUTE_KPIS, tasks).forEach(values::addAll);
        log.info("Computed {} KPI values", values.size());
        return values;
    }

    private List<KpiValue> computeEntity(String entityId, Map<Integer, List<LineItem>> byPeriod) {
        List<KpiValue> values = new ArrayList<>();
        for (Map.Entry<Integer, List<LineItem>> entry : byPeriod.entrySet()) {
            int period = entry.getKey();
            List<LineItem> items = new ArrayList<>(entry.getValue());
            items.addAll(byPeriod.getOrDefault(period - 1, Collections.emptyList()));

            kpiCalculator.computeAll(entityId, period, items).forEach((kpiKey, value) -> values.add(KpiValue.builder()
                    .entityId(entityId)
                    .period(period)
                    .kpiKey(kpiKey)
                    .value(value)
                    .build()));
        }
        return values;
    }

    private List<BenchmarkStat> computeBenchmarks(List<KpiValue> kpiValues, List<Integer> periods,
                                                  Map<String, EntityProfile> profiles) {
        Map<String, List<KpiValue>> valuesByKpi = new LinkedHashMap<>();
        for (KpiValue value : kpiValues) {
            valuesByKpi.computeIfAbsent(value.getKpiKey(), k -> new ArrayList<>()).add(value);
        }

        Map<String, Callable<List<BenchmarkStat>>> tasks = new LinkedHashMap<>();
        for (KpiDefinition definition : catalog.definitions()) {
            List<KpiValue> values = valuesByKpi.getOrDefault(definition.getKey(), Collections.emptyList());
            for (BenchmarkScope scope : catalog.scopes()) {
                tasks.put(definition.getKey() + "/" + scope.getId(), () -> {
                    Map<Integer, List<KpiValue>> valuesByPeriod = new HashMap<>();
                    for (KpiValue value : values) {
                        valuesByPeriod.computeIfAbsent(value.getPeriod(), k -> new ArrayList<>()).add(value);
                    }
                    List<BenchmarkStat> stats = new ArrayList<>();
                    for (int period : periods) {
                        List<KpiValue> periodValues = valuesByPeriod.getOrDefault(period, Collections.emptyList());
                        stats.addAll(benchmarkAggregator
                                .aggregate(definition.getKey(), scope, period, periodValues, profiles)
                                .values());
                    }
                    return stats;
                });
            }
        }
        List<BenchmarkStat> stats = new ArrayList<>();
        runParallel(BuildStage.COMPUTE_BENCHMARKS, tasks).forEach(stats::addAll);
        log.info("Computed {} benchmark stats", stats.size());
        return stats;
    }

    /**
     * Run tasks on the worker pool and return their results in submission order.
     * The first failing task aborts the stage; its key becomes the failure subject.
     */
    private <T> List<T> runParallel(BuildStage stage, Map<String, Callable<T>> tasks) {
        Map<String, Future<T>> futures = new LinkedHashMap<>();
        tasks.forEach((subject, task) -> futures.put(subject, buildWorkerExecutor.submit(task)));

        List<T> results = new ArrayList<>(futures.size());
        try {
            for (Map.Entry<String, Future<T>> entry : futures.entrySet()) {
                try {
                    results.add(entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    throw new BuildFailureException(stage, entry.getKey(), cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new BuildFailureException(stage, entry.getKey(), "Build interrupted", e);
                }
            }
        } finally {
            futures.values().forEach(future -> future.cancel(true));
        }
        return results;
    }

    private void writeChunked(long generationId, List<KpiValue> kpiValues, List<BenchmarkStat> stats) {
        for (int from = 0; from < kpiValues.size(); from += writeChunkSize) {
            precomputedStore.writeKpiValues(generationId,
                    kpiValues.subList(from, Math.min(from + writeChunkSize, kpiValues.size())));
        }
        for (int from = 0; from < stats.size(); from += writeChunkSize) {
            precomputedStore.writeBenchmarkStats(generationId,
                    stats.subList(from, Math.min(from + writeChunkSize, stats.size())));
        }
        log.debug("Wrote generation {} in chunks of {}", generationId, writeChunkSize);
    }

    private void prune(Long previousGeneration) {
        if (previousGeneration == null) {
            return;
        }
        try {
            precomputedStore.pruneBefore(previousGeneration);
        } catch (RuntimeException e) {
            // The new generation is already published; stale rows are retried on the next build.
            log.warn("Pruning generations before {} failed: {}", previousGeneration, e.getMessage());
        }
    }

    private BuildReport fail(long generationId, BuildStage stage, String subject, RuntimeException e,
                             Timer.Sample sample, long startTime) {
        log.error("Build of generation {} failed in {}{}: {}", generationId, stage,
                subject == null ? "" : " (" + subject + ")", e.getMessage(), e);
        try {
            precomputedStore.discard(generationId, stage, subject, e.getMessage());
        } catch (RuntimeException discardError) {
            log.error("Could not discard generation {}: {}", generationId, discardError.getMessage(), discardError);
        }
        recordRun(sample, false);
        return BuildReport.builder()
                .generationId(generationId)
                .succeeded(false)
                .elapsedMs(System.currentTimeMillis() - startTime)
                .failedStage(stage)
                .failedSubject(subject)
                .message(e.getMessage())
                .build();
    }

    private List<String> kpiOrder() {
        return catalog.definitions().stream().map(KpiDefinition::getKey).toList();
    }

    private void recordRun(Timer.Sample sample, boolean succeeded) {
        String result = succeeded ? "success" : "failure";
        sample.stop(Timer.builder("build.duration")
                .tag("result", result)
                .register(meterRegistry));
        Counter.builder("build.runs")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
