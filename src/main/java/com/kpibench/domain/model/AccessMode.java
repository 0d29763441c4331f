package com.kpibench.domain.model;

/**
 * How a query kind can currently be served, from strongest to weakest source.
 */
public enum AccessMode {
    PRECOMPUTED,
    RAW_FALLBACK,
    UNAVAILABLE
}
