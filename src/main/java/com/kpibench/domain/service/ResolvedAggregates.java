package com.kpibench.domain.service;

import com.kpibench.domain.catalog.AggregateDefinition;
import com.kpibench.domain.formula.FormulaContext;
import com.kpibench.domain.model.LineItem;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Aggregate sums of one entity for a period and the period before it.
 *
 * Only aggregates with at least one contributing row are present, which is
 * what separates "no data" from a genuine sum of zero. Rows are summed in
 * (line, column) order so results do not depend on the order the store
 * returned them in.
 */
final class ResolvedAggregates implements FormulaContext {

    private static final Comparator<LineItem> SUMMATION_ORDER =
            Comparator.comparing(LineItem::getLine).thenComparing(LineItem::getColumn);

    private final Map<String, Double> current;
    private final Map<String, Double> previous;

    private ResolvedAggregates(Map<String, Double> current, Map<String, Double> previous) {
        this.current = current;
        this.previous = previous;
    }

    static ResolvedAggregates resolve(String entityId, int period,
                                      Collection<LineItem> lineItems,
                                      Collection<AggregateDefinition> aggregates) {
        List<LineItem> currentItems = select(entityId, period, lineItems);
        List<LineItem> previousItems = select(entityId, period - 1, lineItems);
        return new ResolvedAggregates(sum(currentItems, aggregates), sum(previousItems, aggregates));
    }

    boolean isEmpty() {
        return current.isEmpty();
    }

    @Override
    public OptionalDouble aggregate(String name, int periodOffset) {
        Map<String, Double> source = periodOffset == 0 ? current : previous;
        Double value = source.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    private static List<LineItem> select(String entityId, int period, Collection<LineItem> lineItems) {
        return lineItems.stream()
                .filter(item -> item.getPeriod() == period && entityId.equals(item.getEntityId()))
                .sorted(SUMMATION_ORDER)
                .toList();
    }

    private static Map<String, Double> sum(List<LineItem> items, Collection<AggregateDefinition> aggregates) {
        Map<String, Double> sums = new HashMap<>();
        if (items.isEmpty()) {
            return sums;
        }
        for (AggregateDefinition aggregate : aggregates) {
            double total = 0.0;
            boolean contributed = false;
            for (LineItem item : items) {
                if (aggregate.matches(item)) {
                    total += item.getValue();
                    contributed = true;
                }
            }
            if (contributed) {
                sums.put(aggregate.getName(), total);
            }
        }
        return sums;
    }
}
