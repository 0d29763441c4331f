package com.kpibench.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Benchmarks of every KPI for the peer group an entity belongs to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityBenchmarkResponse {

    private String entityId;
    private int period;
    private String scope;

    // null when the entity lacks a dimension of the scope
    private String scopeKey;

    private Map<String, BenchmarkStat> benchmarks;
    private AccessMode provenance;
}
