package com.kpibench.infrastructure.store;

import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.BuildStage;
import com.kpibench.domain.model.KpiValue;

import java.util.List;

/**
 * Persistence of build generations.
 *
 * Rows are written under their generation id and stay invisible to readers
 * until {@link #publish} moves the marker to that generation.
 */
public interface PrecomputedStore {

    /**
     * Record a new running generation and return its id.
     */
    long openGeneration();

    void writeKpiValues(long generationId, List<KpiValue> values);

    void writeBenchmarkStats(long generationId, List<BenchmarkStat> stats);

    /**
     * Atomically make {@code generationId} the published generation.
     */
    void publish(long generationId, long kpiValueCount, long benchmarkStatCount);

    /**
     * Delete the rows of a failed generation and record why it failed.
     */
    void discard(long generationId, BuildStage stage, String subject, String message);

    /**
     * Delete rows of every generation older than {@code generationId}.
     */
    void pruneBefore(long generationId);

    GenerationProbe probe();

    List<KpiValue> loadKpiValues(long generationId);

    List<BenchmarkStat> loadBenchmarkStats(long generationId);
}
