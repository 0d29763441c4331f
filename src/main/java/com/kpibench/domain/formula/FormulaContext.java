package com.kpibench.domain.formula;

import java.util.OptionalDouble;

/**
 * Supplies aggregate values to a formula being evaluated.
 */
public interface FormulaContext {

    /**
     * @param name         aggregate name
     * @param periodOffset 0 for the evaluated period, -1 for the one before
     * @return empty when no line-item contributes to the aggregate
     */
    OptionalDouble aggregate(String name, int periodOffset);
}
