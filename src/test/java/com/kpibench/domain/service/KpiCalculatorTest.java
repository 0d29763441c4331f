package com.kpibench.domain.service;

import com.kpibench.domain.catalog.KpiCatalog;
import com.kpibench.domain.model.KpiError;
import com.kpibench.domain.model.KpiResult;
import com.kpibench.domain.model.LineItem;
import com.kpibench.support.TestCatalogs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.kpibench.support.TestCatalogs.item;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KpiCalculator.
 */
class KpiCalculatorTest {

    private KpiCatalog catalog;
    private KpiCalculator calculator;

    @BeforeEach
    void setUp() {
        catalog = TestCatalogs.catalog();
        calculator = new KpiCalculator(catalog);
    }

    @Test
    void testCurrentRatio_RoundedToScale() {
        // Given
        List<LineItem> items = List.of(
                item("310001", 2024, "CA", "TOTAL", 3_000_000_000d),
                item("310001", 2024, "CL", "TOTAL", 521_000_000d));

        // When
        KpiResult result = calculator.compute("310001", 2024, catalog.requireDefinition("current_ratio"), items);

        // Then
        assertTrue(result.isPresent());
        assertEquals(5.76, result.value(), 1e-6);
    }

    @Test
    void testZeroDenominator_IsNullNotException() {
        List<LineItem> items = List.of(
                item("e1", 2024, "CA", "TOTAL", 100),
                item("e1", 2024, "CL", "TOTAL", 0));

        KpiResult result = calculator.compute("e1", 2024, catalog.requireDefinition("current_ratio"), items);

        assertEquals(KpiResult.failure(KpiError.ZERO_DENOMINATOR), result);
        assertNull(result.value());
    }

    @Test
    void testMissingAggregate_IsInsufficientData_ButZeroSumIsAValue() {
        // Given: no CL rows at all vs. CA rows summing to zero
        List<LineItem> missing = List.of(item("e1", 2024, "CA", "TOTAL", 100));
        List<LineItem> zeroSum = List.of(
                item("e1", 2024, "CA", "TOTAL", 50),
                item("e1", 2024, "CA", "TOTAL", -50),
                item("e1", 2024, "CL", "TOTAL", 10));

        // When
        KpiResult missingResult = calculator.compute("e1", 2024, catalog.requireDefinition("current_ratio"), missing);
        KpiResult zeroResult = calculator.compute("e1", 2024, catalog.requireDefinition("current_ratio"), zeroSum);

        // Then
        assertEquals(KpiError.INSUFFICIENT_DATA, missingResult.error());
        assertTrue(zeroResult.isPresent());
        assertEquals(0.0, zeroResult.value(), 0.0);
    }

    @Test
    void testColumnFilter_IgnoresOtherColumns() {
        List<LineItem> items = List.of(
                item("e1", 2024, "CA", "TOTAL", 300),
                item("e1", 2024, "CA", "FUND_2", 9_999),
                item("e1", 2024, "CL", "TOTAL", 100));

        KpiResult result = calculator.compute("e1", 2024, catalog.requireDefinition("current_ratio"), items);

        assertEquals(3.0, result.value(), 1e-9);
    }

    @Test
    void testRevenueGrowth_ReadsPreviousPeriod() {
        List<LineItem> items = List.of(
                item("e1", 2023, "REV", "1", 200),
                item("e1", 2024, "REV", "1", 250),
                item("e2", 2023, "REV", "1", 1));

        KpiResult growth = calculator.compute("e1", 2024, catalog.requireDefinition("revenue_growth"), items);
        KpiResult firstYear = calculator.compute("e1", 2023, catalog.requireDefinition("revenue_growth"), items);

        assertEquals(25.0, growth.value(), 1e-9);
        assertEquals(KpiError.INSUFFICIENT_DATA, firstYear.error());
    }

    @Test
    void testUnmapped_AlwaysNull() {
        List<LineItem> items = List.of(item("e1", 2024, "CA", "TOTAL", 1));

        KpiResult result = calculator.compute("e1", 2024, catalog.requireDefinition("reserve_ratio"), items);

        assertEquals(KpiError.UNMAPPED, result.error());
    }

    @Test
    void testComputeAll_CatalogOrderWithNulls() {
        // Given
        List<LineItem> items = List.of(
                item("e1", 2024, "CA", "TOTAL", 300),
                item("e1", 2024, "CL", "TOTAL", 100),
                item("e1", 2024, "REV", "1", 1000),
                item("e1", 2024, "OPEX", "1", 900));

        // When
        Map<String, Double> values = calculator.computeAll("e1", 2024, items);

        // Then
        assertEquals(TestCatalogs.KPI_KEYS, new ArrayList<>(values.keySet()));
        assertEquals(3.0, values.get("current_ratio"), 1e-9);
        assertEquals(10.0, values.get("margin"), 1e-9);
        assertEquals(0.9, values.get("opex_ratio"), 1e-9);
        assertNull(values.get("revenue_growth"));
        assertNull(values.get("reserve_ratio"));
    }

    @Test
    void testComputeAll_UnknownEntityOrPeriodIsEmpty() {
        List<LineItem> items = List.of(item("e1", 2024, "CA", "TOTAL", 300));

        assertTrue(calculator.computeAll("e2", 2024, items).isEmpty());
        assertTrue(calculator.computeAll("e1", 2025, items).isEmpty());
    }

    @Test
    void testComputeAll_IndependentOfInputOrder() {
        List<LineItem> items = new ArrayList<>(List.of(
                item("e1", 2024, "REV", "1", 0.1),
                item("e1", 2024, "REV", "2", 0.2),
                item("e1", 2024, "REV", "3", 0.3),
                item("e1", 2024, "OPEX", "1", 0.05)));
        Map<String, Double> forward = calculator.computeAll("e1", 2024, items);

        Collections.reverse(items);
        Map<String, Double> reversed = calculator.computeAll("e1", 2024, items);

        assertEquals(forward, reversed);
    }

    @Test
    void testRound_HalfUp() {
        assertEquals(2.35, KpiCalculator.round(2.345, 2), 1e-12);
        assertEquals(-2.35, KpiCalculator.round(-2.345, 2), 1e-12);
        assertEquals(1.23456, KpiCalculator.round(1.23456, null), 1e-12);
    }
}
