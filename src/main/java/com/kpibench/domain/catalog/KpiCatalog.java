package com.kpibench.domain.catalog;

import com.kpibench.domain.exception.ConfigurationException;
import com.kpibench.domain.formula.AggregateReference;
import com.kpibench.domain.model.BenchmarkScope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated registry of aggregates, KPI definitions and benchmark scopes.
 *
 * Construction fails with {@link ConfigurationException} on any duplicate key,
 * dangling or mis-levelled parent, cycle, or formula reference to an unknown
 * aggregate. Once built the catalog is immutable and shared freely.
 */
public class KpiCatalog {

    public static final int MAX_LEVEL = 3;

    private final Map<String, AggregateDefinition> aggregates;
    private final Map<String, KpiDefinition> definitions;
    private final Map<String, List<KpiDefinition>> children;
    private final Map<String, BenchmarkScope> scopes;

    public KpiCatalog(Collection<AggregateDefinition> aggregates,
                      List<KpiDefinition> definitions,
                      List<BenchmarkScope> scopes) {
        this.aggregates = indexAggregates(aggregates);
        this.definitions = indexDefinitions(definitions);
        this.scopes = indexScopes(scopes);
        validateTree();
        validateFormulas();
        this.children = indexChildren();
    }

    public List<KpiDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    public Optional<KpiDefinition> definition(String key) {
        return Optional.ofNullable(definitions.get(key));
    }

    public KpiDefinition requireDefinition(String key) {
        KpiDefinition definition = definitions.get(key);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown KPI: " + key);
        }
        return definition;
    }

    public Map<String, AggregateDefinition> aggregates() {
        return aggregates;
    }

    public List<BenchmarkScope> scopes() {
        return List.copyOf(scopes.values());
    }

    public Optional<BenchmarkScope> scope(String id) {
        return Optional.ofNullable(scopes.get(id));
    }

    public BenchmarkScope requireScope(String id) {
        BenchmarkScope scope = scopes.get(id);
        if (scope == null) {
            throw new IllegalArgumentException("Unknown benchmark scope: " + id);
        }
        return scope;
    }

    public List<KpiDefinition> roots() {
        return definitions.values().stream()
                .filter(d -> d.getLevel() == 1)
                .toList();
    }

    public List<KpiDefinition> children(String key) {
        return children.getOrDefault(key, List.of());
    }

    /**
     * Path from the level-1 ancestor down to {@code key}, inclusive.
     */
    public List<KpiDefinition> lineage(String key) {
        LinkedList<KpiDefinition> path = new LinkedList<>();
        KpiDefinition current = requireDefinition(key);
        while (current != null) {
            path.addFirst(current);
            current = current.getParentKey() == null ? null : definitions.get(current.getParentKey());
        }
        return List.copyOf(path);
    }

    private static Map<String, AggregateDefinition> indexAggregates(Collection<AggregateDefinition> aggregates) {
        Map<String, AggregateDefinition> index = new LinkedHashMap<>();
        for (AggregateDefinition aggregate : aggregates) {
            if (aggregate.getLines().isEmpty()) {
                throw new ConfigurationException("Aggregate " + aggregate.getName() + " selects no line codes");
            }
            if (index.put(aggregate.getName(), aggregate) != null) {
                throw new ConfigurationException("Duplicate aggregate: " + aggregate.getName());
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private static Map<String, KpiDefinition> indexDefinitions(List<KpiDefinition> definitions) {
        if (definitions.isEmpty()) {
            throw new ConfigurationException("KPI catalog is empty");
        }
        Map<String, KpiDefinition> index = new LinkedHashMap<>();
        for (KpiDefinition definition : definitions) {
            if (definition.getKey() == null || definition.getKey().isBlank()) {
                throw new ConfigurationException("KPI definition without key");
            }
            if (index.put(definition.getKey(), definition) != null) {
                throw new ConfigurationException("Duplicate KPI key: " + definition.getKey());
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private static Map<String, BenchmarkScope> indexScopes(List<BenchmarkScope> scopes) {
        Map<String, BenchmarkScope> index = new LinkedHashMap<>();
        for (BenchmarkScope scope : scopes) {
            if (new HashSet<>(scope.getDimensions()).size() != scope.getDimensions().size()) {
                throw new ConfigurationException("Scope " + scope.getId() + " repeats a dimension");
            }
            if (index.put(scope.getId(), scope) != null) {
                throw new ConfigurationException("Duplicate benchmark scope: " + scope.getId());
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private void validateTree() {
        for (KpiDefinition definition : definitions.values()) {
            String key = definition.getKey();
            int level = definition.getLevel();
            if (level < 1 || level > MAX_LEVEL) {
                throw new ConfigurationException("KPI " + key + " has invalid level " + level);
            }
            String parentKey = definition.getParentKey();
            if (level == 1) {
                if (parentKey != null) {
                    throw new ConfigurationException("Level-1 KPI " + key + " must not have a parent");
                }
                continue;
            }
            if (parentKey == null) {
                throw new ConfigurationException("Level-" + level + " KPI " + key + " has no parent");
            }
            KpiDefinition parent = definitions.get(parentKey);
            if (parent == null) {
                throw new ConfigurationException("KPI " + key + " references unknown parent " + parentKey);
            }
            if (parent.getLevel() != level - 1) {
                throw new ConfigurationException("KPI " + key + " (level " + level + ") has parent "
                        + parentKey + " at level " + parent.getLevel());
            }
        }
        for (KpiDefinition definition : definitions.values()) {
            Set<String> seen = new HashSet<>();
            KpiDefinition current = definition;
            while (current != null) {
                if (!seen.add(current.getKey())) {
                    throw new ConfigurationException("Cycle in KPI tree at " + current.getKey());
                }
                current = current.getParentKey() == null ? null : definitions.get(current.getParentKey());
            }
        }
    }

    private void validateFormulas() {
        for (KpiDefinition definition : definitions.values()) {
            if (definition.isUnmapped()) {
                continue;
            }
            for (AggregateReference reference : definition.getFormula().getReferences()) {
                if (!aggregates.containsKey(reference.getName())) {
                    throw new ConfigurationException("KPI " + definition.getKey()
                            + " references unknown aggregate " + reference.getName());
                }
            }
        }
    }

    private Map<String, List<KpiDefinition>> indexChildren() {
        Map<String, List<KpiDefinition>> index = new LinkedHashMap<>();
        for (KpiDefinition definition : definitions.values()) {
            if (definition.getParentKey() != null) {
                index.computeIfAbsent(definition.getParentKey(), k -> new ArrayList<>()).add(definition);
            }
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(index);
    }
}
