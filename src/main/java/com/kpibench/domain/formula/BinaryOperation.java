package com.kpibench.domain.formula;

import com.kpibench.domain.model.KpiError;
import lombok.Value;

import java.util.Set;

@Value
public class BinaryOperation implements Expression {

    char operator;
    Expression left;
    Expression right;

    @Override
    public double evaluate(FormulaContext context) {
        double l = left.evaluate(context);
        double r = right.evaluate(context);
        return switch (operator) {
            case '+' -> l + r;
            case '-' -> l - r;
            case '*' -> l * r;
            case '/' -> {
                if (r == 0.0) {
                    throw new FormulaEvaluationException(KpiError.ZERO_DENOMINATOR,
                            "Denominator " + right + " is zero");
                }
                yield l / r;
            }
            default -> throw new IllegalStateException("Unknown operator: " + operator);
        };
    }

    @Override
    public void collectReferences(Set<AggregateReference> references) {
        left.collectReferences(references);
        right.collectReferences(references);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
