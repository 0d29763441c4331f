package com.kpibench.domain.formula;

import lombok.Value;

import java.util.Set;

@Value
public class NumberLiteral implements Expression {

    double value;

    @Override
    public double evaluate(FormulaContext context) {
        return value;
    }

    @Override
    public void collectReferences(Set<AggregateReference> references) {
        // no references
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
