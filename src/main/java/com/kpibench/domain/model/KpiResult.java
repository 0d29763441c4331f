package com.kpibench.domain.model;

import java.util.Objects;

/**
 * Outcome of computing one KPI: either a value or a {@link KpiError}.
 */
public final class KpiResult {

    private final Double value;
    private final KpiError error;

    private KpiResult(Double value, KpiError error) {
        this.value = value;
        this.error = error;
    }

    public static KpiResult of(double value) {
        return new KpiResult(value, null);
    }

    public static KpiResult failure(KpiError error) {
        return new KpiResult(null, Objects.requireNonNull(error));
    }

    public boolean isPresent() {
        return error == null;
    }

    public Double value() {
        return value;
    }

    public KpiError error() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KpiResult other)) {
            return false;
        }
        return Objects.equals(value, other.value) && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isPresent() ? "KpiResult[" + value + "]" : "KpiResult[" + error + "]";
    }
}
