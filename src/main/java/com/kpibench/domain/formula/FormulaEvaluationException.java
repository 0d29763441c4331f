package com.kpibench.domain.formula;

import com.kpibench.domain.model.KpiError;
import lombok.Getter;

/**
 * Signals a soft evaluation failure. Never escapes the KPI calculator.
 */
@Getter
public class FormulaEvaluationException extends RuntimeException {

    private final KpiError error;

    public FormulaEvaluationException(KpiError error, String message) {
        super(message, null, false, false);
        this.error = error;
    }
}
