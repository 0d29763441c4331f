package com.kpibench.domain.model;

/**
 * Build pipeline stages, in execution order.
 */
public enum BuildStage {
    LOAD,
    COMPUTE_KPIS,
    COMPUTE_BENCHMARKS,
    BUILD_INDEXES,
    PUBLISH
}
