package com.kpibench.domain.formula;

import lombok.Value;

import java.util.Set;

@Value
public class Negation implements Expression {

    Expression operand;

    @Override
    public double evaluate(FormulaContext context) {
        return -operand.evaluate(context);
    }

    @Override
    public void collectReferences(Set<AggregateReference> references) {
        operand.collectReferences(references);
    }

    @Override
    public String toString() {
        return "-" + operand;
    }
}
