package com.kpibench.domain.formula;

import com.kpibench.domain.model.KpiError;
import lombok.Value;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * Reference to a named aggregate, optionally in the previous period.
 */
@Value
public class AggregateTerm implements Expression {

    String name;
    int periodOffset;

    @Override
    public double evaluate(FormulaContext context) {
        OptionalDouble value = context.aggregate(name, periodOffset);
        if (value.isEmpty()) {
            throw new FormulaEvaluationException(KpiError.INSUFFICIENT_DATA,
                    "No line-items for aggregate " + this);
        }
        return value.getAsDouble();
    }

    @Override
    public void collectReferences(Set<AggregateReference> references) {
        references.add(new AggregateReference(name, periodOffset));
    }

    @Override
    public String toString() {
        return periodOffset == 0 ? name : "prev(" + name + ")";
    }
}
