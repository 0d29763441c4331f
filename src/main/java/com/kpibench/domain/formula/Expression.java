package com.kpibench.domain.formula;

import java.util.Set;

/**
 * Node of a parsed KPI formula.
 */
public interface Expression {

    /**
     * @throws FormulaEvaluationException when an aggregate has no rows or a
     *                                    denominator is exactly zero
     */
    double evaluate(FormulaContext context);

    void collectReferences(Set<AggregateReference> references);
}
