package com.kpibench.domain.service;

import com.kpibench.domain.catalog.KpiCatalog;
import com.kpibench.domain.catalog.KpiDefinition;
import com.kpibench.domain.exception.ComputationCancelledException;
import com.kpibench.domain.formula.FormulaEvaluationException;
import com.kpibench.domain.model.KpiError;
import com.kpibench.domain.model.KpiResult;
import com.kpibench.domain.model.LineItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes KPI values from raw line-items.
 *
 * Pure and deterministic: the same definition and line-items always give the
 * same result. Soft failures (missing aggregate, zero denominator, unmapped
 * KPI) come back as a {@link KpiResult} error and never as an exception.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KpiCalculator {

    private final KpiCatalog catalog;

    /**
     * Compute one KPI for one entity and period.
     *
     * @param lineItems line-items of the entity; may include other periods and
     *                  entities, only (entityId, period) and (entityId, period - 1)
     *                  rows are read
     */
    public KpiResult compute(String entityId, int period, KpiDefinition definition,
                             Collection<LineItem> lineItems) {
        if (definition.isUnmapped()) {
            return KpiResult.failure(KpiError.UNMAPPED);
        }
        ResolvedAggregates aggregates = ResolvedAggregates.resolve(
                entityId, period, lineItems, catalog.aggregates().values());
        return evaluate(definition, aggregates);
    }

    /**
     * Compute every catalog KPI for one entity and period, in catalog order.
     *
     * @return an empty map when the entity has no line-items in the period,
     * otherwise one entry per KPI with null for values that could not be computed
     */
    public Map<String, Double> computeAll(String entityId, int period, Collection<LineItem> lineItems) {
        ResolvedAggregates aggregates = ResolvedAggregates.resolve(
                entityId, period, lineItems, catalog.aggregates().values());
        ComputationCancelledException.checkpoint("aggregate resolution");

        Map<String, Double> values = new LinkedHashMap<>();
        if (aggregates.isEmpty()) {
            return values;
        }
        for (KpiDefinition definition : catalog.definitions()) {
            KpiResult result = definition.isUnmapped()
                    ? KpiResult.failure(KpiError.UNMAPPED)
                    : evaluate(definition, aggregates);
            values.put(definition.getKey(), result.value());
        }
        return values;
    }

    private KpiResult evaluate(KpiDefinition definition, ResolvedAggregates aggregates) {
        double raw;
        try {
            raw = definition.getFormula().evaluate(aggregates);
        } catch (FormulaEvaluationException e) {
            log.trace("KPI {} not computed: {}", definition.getKey(), e.getMessage());
            return KpiResult.failure(e.getError());
        }
        if (!Double.isFinite(raw)) {
            return KpiResult.failure(KpiError.INSUFFICIENT_DATA);
        }
        return KpiResult.of(round(raw, definition.getScale()));
    }

    static double round(double value, Integer scale) {
        if (scale == null) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
