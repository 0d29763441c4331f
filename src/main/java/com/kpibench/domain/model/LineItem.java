package com.kpibench.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One immutable financial line-item value.
 *
 * Unique per (entityId, period, line, column). Produced upstream,
 * consumed read-only.
 */
@Value
@Builder
public class LineItem {

    String entityId;
    int period;
    String line;
    String column;
    double value;
}
