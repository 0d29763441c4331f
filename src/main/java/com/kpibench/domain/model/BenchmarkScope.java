package com.kpibench.domain.model;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Named partition function mapping an entity to a peer-group key.
 *
 * A scope without dimensions puts every entity under {@value #ALL_KEY}.
 * Otherwise the key is the entity's dimension values joined by ':'
 * in declaration order, e.g. "TX:Critical Access".
 */
@Value
public class BenchmarkScope {

    public static final String ALL_KEY = "all";

    String id;
    List<ScopeDimension> dimensions;

    public BenchmarkScope(String id, List<ScopeDimension> dimensions) {
        this.id = id;
        this.dimensions = List.copyOf(dimensions);
    }

    /**
     * Resolve the scope key for an entity.
     *
     * @param profile the entity's profile, null when the entity has none
     * @return empty when the entity lacks a dimension this scope needs
     */
    public Optional<String> scopeKeyFor(EntityProfile profile) {
        if (dimensions.isEmpty()) {
            return Optional.of(ALL_KEY);
        }
        if (profile == null) {
            return Optional.empty();
        }
        StringBuilder key = new StringBuilder();
        for (ScopeDimension dimension : dimensions) {
            Optional<String> value = profile.dimension(dimension);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            if (key.length() > 0) {
                key.append(':');
            }
            key.append(value.get());
        }
        return Optional.of(key.toString());
    }
}
