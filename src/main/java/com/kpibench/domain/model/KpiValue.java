package com.kpibench.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Computed value of one KPI for one entity and period.
 *
 * A null value means the source data was insufficient (or the
 * denominator was zero); it is never replaced by 0.
 */
@Value
@Builder
public class KpiValue {

    String entityId;
    int period;
    String kpiKey;
    Double value;

    public boolean hasValue() {
        return value != null;
    }
}
