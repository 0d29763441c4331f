package com.kpibench.domain.formula;

import com.kpibench.domain.exception.ConfigurationException;
import com.kpibench.domain.model.KpiError;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FormulaParser.
 */
class FormulaParserTest {

    private static final FormulaContext CONTEXT = (name, offset) -> {
        Map<String, Double> values = offset == 0
                ? Map.of("A", 6.0, "B", 3.0, "C", 2.0, "ZERO", 0.0)
                : Map.of("A", 4.0);
        Double value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    };

    @Test
    void testParse_MultiplicationBindsTighterThanAddition() {
        assertEquals(12.0, FormulaParser.parse("A + B * C").evaluate(CONTEXT), 1e-9);
        assertEquals(18.0, FormulaParser.parse("(A + B) * C").evaluate(CONTEXT), 1e-9);
    }

    @Test
    void testParse_LeftAssociativeSubtractionAndDivision() {
        assertEquals(1.0, FormulaParser.parse("A - B - C").evaluate(CONTEXT), 1e-9);
        assertEquals(1.0, FormulaParser.parse("A / B / C").evaluate(CONTEXT), 1e-9);
    }

    @Test
    void testParse_UnaryMinusAndLiterals() {
        assertEquals(-3.0, FormulaParser.parse("-B").evaluate(CONTEXT), 1e-9);
        assertEquals(300.0, FormulaParser.parse("A / C * 100").evaluate(CONTEXT), 1e-9);
        assertEquals(0.5, FormulaParser.parse("1.5 / B").evaluate(CONTEXT), 1e-9);
    }

    @Test
    void testParse_PreviousPeriodReference() {
        // Given
        Formula growth = FormulaParser.parse("(A - prev(A)) / prev(A) * 100");

        // When
        double value = growth.evaluate(CONTEXT);

        // Then
        assertEquals(50.0, value, 1e-9);
        assertTrue(growth.readsPreviousPeriod());
        assertTrue(growth.getReferences().contains(new AggregateReference("A", -1)));
        assertTrue(growth.getReferences().contains(new AggregateReference("A", 0)));
    }

    @Test
    void testEvaluate_ZeroDenominator() {
        FormulaEvaluationException e = assertThrows(FormulaEvaluationException.class,
                () -> FormulaParser.parse("A / ZERO").evaluate(CONTEXT));
        assertEquals(KpiError.ZERO_DENOMINATOR, e.getError());
    }

    @Test
    void testEvaluate_MissingAggregateIsInsufficientData() {
        FormulaEvaluationException e = assertThrows(FormulaEvaluationException.class,
                () -> FormulaParser.parse("B / prev(B)").evaluate(CONTEXT));
        assertEquals(KpiError.INSUFFICIENT_DATA, e.getError());
    }

    @Test
    void testParse_SyntaxErrors() {
        assertThrows(ConfigurationException.class, () -> FormulaParser.parse(""));
        assertThrows(ConfigurationException.class, () -> FormulaParser.parse("A +"));
        assertThrows(ConfigurationException.class, () -> FormulaParser.parse("(A + B"));
        assertThrows(ConfigurationException.class, () -> FormulaParser.parse("A B"));
        assertThrows(ConfigurationException.class, () -> FormulaParser.parse("A % B"));
        assertThrows(ConfigurationException.class, () -> FormulaParser.parse("prev(1)"));
        assertThrows(ConfigurationException.class, () -> FormulaParser.parse("1.2.3"));
    }

    @Test
    void testParse_ErrorNamesPosition() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> FormulaParser.parse("A + * B"));
        assertTrue(e.getMessage().contains("position 4"), e.getMessage());
    }
}
