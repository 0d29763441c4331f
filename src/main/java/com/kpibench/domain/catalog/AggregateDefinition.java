package com.kpibench.domain.catalog;

import com.kpibench.domain.model.LineItem;
import lombok.Value;

import java.util.Set;

/**
 * Named sum over the line-items whose line code is in {@code lines} and whose
 * column code is in {@code columns} (any column when {@code columns} is empty).
 */
@Value
public class AggregateDefinition {

    String name;
    Set<String> lines;
    Set<String> columns;

    public AggregateDefinition(String name, Set<String> lines, Set<String> columns) {
        this.name = name;
        this.lines = Set.copyOf(lines);
        this.columns = columns == null ? Set.of() : Set.copyOf(columns);
    }

    public boolean matches(LineItem item) {
        return lines.contains(item.getLine())
                && (columns.isEmpty() || columns.contains(item.getColumn()));
    }
}
