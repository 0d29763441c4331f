package com.kpibench.domain.model;

/**
 * Query families whose availability is detected independently.
 */
public enum QueryKind {
    KPI_VALUES,
    BENCHMARKS
}
