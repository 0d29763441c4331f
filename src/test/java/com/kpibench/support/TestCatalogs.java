package com.kpibench.support;

import com.kpibench.domain.catalog.AggregateDefinition;
import com.kpibench.domain.catalog.KpiCatalog;
import com.kpibench.domain.catalog.KpiDefinition;
import com.kpibench.domain.formula.FormulaParser;
import com.kpibench.domain.model.BenchmarkScope;
import com.kpibench.domain.model.EntityProfile;
import com.kpibench.domain.model.LineItem;
import com.kpibench.domain.model.ScopeDimension;

import java.util.List;
import java.util.Set;

/**
 * Small KPI catalog and line-item fixtures shared by the service tests.
 *
 * KPIs, in catalog order:
 * current_ratio (L1) = CA / CL, scale 2
 * margin (L1) = (REV - OPEX) / REV * 100, scale 1
 * opex_ratio (L2 of margin) = OPEX / REV
 * revenue_growth (L2 of margin) = (REV - prev(REV)) / prev(REV) * 100, scale 1
 * reserve_ratio (L2 of current_ratio) = unmapped
 */
public final class TestCatalogs {

    public static final List<String> KPI_KEYS =
            List.of("current_ratio", "margin", "opex_ratio", "revenue_growth", "reserve_ratio");

    private TestCatalogs() {
    }

    public static KpiCatalog catalog() {
        List<AggregateDefinition> aggregates = List.of(
                new AggregateDefinition("CA", Set.of("CA"), Set.of("TOTAL")),
                new AggregateDefinition("CL", Set.of("CL"), Set.of("TOTAL")),
                new AggregateDefinition("REV", Set.of("REV"), Set.of()),
                new AggregateDefinition("OPEX", Set.of("OPEX"), Set.of()));

        List<KpiDefinition> kpis = List.of(
                kpi("current_ratio", 1, null, "CA / CL", 2),
                kpi("margin", 1, null, "(REV - OPEX) / REV * 100", 1),
                kpi("opex_ratio", 2, "margin", "OPEX / REV", null),
                kpi("revenue_growth", 2, "margin", "(REV - prev(REV)) / prev(REV) * 100", 1),
                KpiDefinition.builder()
                        .key("reserve_ratio")
                        .name("reserve_ratio")
                        .level(2)
                        .parentKey("current_ratio")
                        .unit("ratio")
                        .higherIsBetter(true)
                        .build());

        List<BenchmarkScope> scopes = List.of(
                new BenchmarkScope("all", List.of()),
                new BenchmarkScope("region", List.of(ScopeDimension.REGION)),
                new BenchmarkScope("region-category", List.of(ScopeDimension.REGION, ScopeDimension.CATEGORY)));

        return new KpiCatalog(aggregates, kpis, scopes);
    }

    /**
     * Five entities over 2023-2024: TX/Rural, TX/Urban, CA/Rural, one without a
     * profile, and one TX/Rural entity whose current liabilities are zero.
     */
    public static InMemoryLineItemStore sampleStore() {
        return new InMemoryLineItemStore()
                .add(item("310001", 2023, "CA", "TOTAL", 1),
                        item("310001", 2023, "CL", "TOTAL", 1),
                        item("310001", 2023, "REV", "1", 800),
                        item("310001", 2024, "CA", "TOTAL", 3_000_000_000d),
                        item("310001", 2024, "CL", "TOTAL", 521_000_000d),
                        item("310001", 2024, "REV", "1", 1000),
                        item("310001", 2024, "OPEX", "1", 900),
                        item("310002", 2023, "REV", "1", 500),
                        item("310002", 2024, "CA", "TOTAL", 200),
                        item("310002", 2024, "CL", "TOTAL", 100),
                        item("310002", 2024, "REV", "1", 500),
                        item("310002", 2024, "OPEX", "1", 550),
                        item("310003", 2024, "CA", "TOTAL", 300),
                        item("310003", 2024, "CL", "TOTAL", 100),
                        item("310003", 2024, "REV", "1", 100),
                        item("310003", 2024, "OPEX", "1", 50),
                        item("310004", 2024, "CA", "TOTAL", 100),
                        item("310004", 2024, "CL", "TOTAL", 50),
                        item("310005", 2024, "CA", "TOTAL", 100),
                        item("310005", 2024, "CL", "TOTAL", 0),
                        item("310005", 2024, "REV", "1", 10),
                        item("310005", 2024, "OPEX", "1", 10))
                .addProfile(profile("310001", "TX", "Rural"))
                .addProfile(profile("310002", "TX", "Urban"))
                .addProfile(profile("310003", "CA", "Rural"))
                .addProfile(profile("310005", "TX", "Rural"));
    }

    public static KpiDefinition kpi(String key, int level, String parent, String formula, Integer scale) {
        return KpiDefinition.builder()
                .key(key)
                .name(key)
                .level(level)
                .parentKey(parent)
                .formula(FormulaParser.parse(formula))
                .unit("ratio")
                .higherIsBetter(true)
                .scale(scale)
                .build();
    }

    public static LineItem item(String entityId, int period, String line, String column, double value) {
        return LineItem.builder()
                .entityId(entityId)
                .period(period)
                .line(line)
                .column(column)
                .value(value)
                .build();
    }

    public static EntityProfile profile(String entityId, String region, String category) {
        return EntityProfile.builder()
                .entityId(entityId)
                .region(region)
                .category(category)
                .build();
    }
}
