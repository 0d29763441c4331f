package com.kpibench.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * An entity that reports line-items, with its peer-group attributes and
 * the span of periods it has reported.
 *
 * region and category are null for entities without a profile.
 */
@Value
@Builder
public class EntitySummary {

    String entityId;
    String region;
    String category;
    int periodCount;
    int firstPeriod;
    int latestPeriod;
}
