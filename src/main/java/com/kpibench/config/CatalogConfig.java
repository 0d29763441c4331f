package com.kpibench.config;

import com.kpibench.domain.catalog.AggregateDefinition;
import com.kpibench.domain.catalog.KpiCatalog;
import com.kpibench.domain.catalog.KpiDefinition;
import com.kpibench.domain.exception.ConfigurationException;
import com.kpibench.domain.formula.FormulaParser;
import com.kpibench.domain.model.BenchmarkScope;
import com.kpibench.domain.model.ScopeDimension;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * Builds the validated {@link KpiCatalog} at startup.
 *
 * Any configuration error aborts context refresh before a query is served.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CatalogProperties.class)
public class CatalogConfig {

    @Bean
    public KpiCatalog kpiCatalog(CatalogProperties properties) {
        KpiCatalog catalog = toCatalog(properties);
        log.info("KPI catalog loaded: {} KPIs ({} roots), {} aggregates, {} scopes",
                catalog.definitions().size(), catalog.roots().size(),
                catalog.aggregates().size(), catalog.scopes().size());
        return catalog;
    }

    public static KpiCatalog toCatalog(CatalogProperties properties) {
        List<AggregateDefinition> aggregates = properties.getAggregates().entrySet().stream()
                .map(e -> new AggregateDefinition(e.getKey(),
                        new HashSet<>(e.getValue().getLines()),
                        new HashSet<>(e.getValue().getColumns())))
                .toList();

        List<KpiDefinition> definitions = properties.getKpis().stream()
                .map(CatalogConfig::toDefinition)
                .toList();

        List<BenchmarkScope> scopes = properties.getScopes().stream()
                .map(CatalogConfig::toScope)
                .toList();

        return new KpiCatalog(aggregates, definitions, scopes);
    }

    private static KpiDefinition toDefinition(CatalogProperties.Kpi kpi) {
        boolean hasFormula = kpi.getFormula() != null && !kpi.getFormula().isBlank();
        if (hasFormula == kpi.isUnmapped()) {
            throw new ConfigurationException("KPI " + kpi.getKey()
                    + " must declare exactly one of 'formula' or 'unmapped: true'");
        }
        if (kpi.getScale() != null && kpi.getScale() < 0) {
            throw new ConfigurationException("KPI " + kpi.getKey() + " has negative scale");
        }
        return KpiDefinition.builder()
                .key(kpi.getKey())
                .name(kpi.getName() != null ? kpi.getName() : kpi.getKey())
                .level(kpi.getLevel())
                .parentKey(kpi.getParent())
                .formula(hasFormula ? FormulaParser.parse(kpi.getFormula()) : null)
                .unit(kpi.getUnit())
                .higherIsBetter(kpi.isHigherIsBetter())
                .scale(kpi.getScale())
                .build();
    }

    private static BenchmarkScope toScope(CatalogProperties.Scope scope) {
        if (scope.getId() == null || scope.getId().isBlank()) {
            throw new ConfigurationException("Benchmark scope without id");
        }
        List<ScopeDimension> dimensions = scope.getDimensions().stream()
                .map(d -> {
                    try {
                        return ScopeDimension.valueOf(d.trim().toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new ConfigurationException("Scope " + scope.getId()
                                + " has unknown dimension " + d, e);
                    }
                })
                .toList();
        return new BenchmarkScope(scope.getId(), dimensions);
    }
}
