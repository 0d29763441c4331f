package com.kpibench.domain.formula;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A parsed formula together with the aggregates it reads.
 */
@Getter
public class Formula {

    private final String source;
    private final Expression root;
    private final Set<AggregateReference> references;

    public Formula(String source, Expression root) {
        this.source = source;
        this.root = root;
        Set<AggregateReference> refs = new LinkedHashSet<>();
        root.collectReferences(refs);
        this.references = Collections.unmodifiableSet(refs);
    }

    public double evaluate(FormulaContext context) {
        return root.evaluate(context);
    }

    public boolean readsPreviousPeriod() {
        return references.stream().anyMatch(ref -> ref.getPeriodOffset() != 0);
    }

    @Override
    public String toString() {
        return source;
    }
}
