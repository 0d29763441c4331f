package com.kpibench.domain.model;

/**
 * Soft computation failures. None of them is ever thrown to a caller.
 */
public enum KpiError {
    INSUFFICIENT_DATA,
    ZERO_DENOMINATOR,
    UNMAPPED
}
