package com.kpibench.domain.catalog;

import com.kpibench.domain.formula.Formula;
import lombok.Builder;
import lombok.Value;

/**
 * One node of the three-level KPI tree.
 *
 * A child KPI has its own formula over raw aggregates; it is never derived
 * from the parent's computed value. A definition without a formula is
 * explicitly unmapped and always evaluates to null.
 */
@Value
@Builder
public class KpiDefinition {

    String key;
    String name;
    int level;
    String parentKey;
    Formula formula;
    String unit;
    boolean higherIsBetter;

    // decimal places the computed value is rounded to, null keeps full precision
    Integer scale;

    public boolean isUnmapped() {
        return formula == null;
    }
}
