package com.kpibench.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static KPI tree, aggregate and scope configuration (app.catalog.*).
 *
 * Field-level constraints are checked on binding; cross-references (parents,
 * aggregate names, cycles) are checked when the
 * {@link com.kpibench.domain.catalog.KpiCatalog} is assembled.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.catalog")
public class CatalogProperties {

    @Valid
    private Map<String, Aggregate> aggregates = new LinkedHashMap<>();

    @Valid
    @NotEmpty
    private List<Kpi> kpis = new ArrayList<>();

    @Valid
    private List<Scope> scopes = new ArrayList<>();

    @Data
    public static class Aggregate {
        @NotEmpty
        private List<String> lines = new ArrayList<>();
        private List<String> columns = new ArrayList<>();
    }

    @Data
    public static class Kpi {
        @NotBlank
        private String key;
        private String name;
        @Min(1)
        @Max(3)
        private int level;
        private String parent;
        private String formula;
        private boolean unmapped;
        private String unit;
        private boolean higherIsBetter = true;
        private Integer scale;
    }

    @Data
    public static class Scope {
        @NotBlank
        private String id;
        private List<String> dimensions = new ArrayList<>();
    }
}
