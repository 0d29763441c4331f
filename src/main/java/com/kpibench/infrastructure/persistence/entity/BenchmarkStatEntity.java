package com.kpibench.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Precomputed peer-group statistics of one build generation.
 * Partitions without samples have no row.
 */
@Entity
@Table(name = "benchmark_stats", indexes = {
    @Index(name = "idx_benchmark_lookup", columnList = "generation_id,kpi_key,scope_id,scope_key,period"),
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkStatEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "benchmark_stat_seq")
    @SequenceGenerator(name = "benchmark_stat_seq", sequenceName = "benchmark_stat_seq", allocationSize = 500)
    private Long id;

    @Column(name = "generation_id", nullable = false)
    private Long generationId;

    @Column(name = "kpi_key", nullable = false, length = 100)
    private String kpiKey;

    @Column(name = "scope_id", nullable = false, length = 50)
    private String scopeId;

    @Column(name = "scope_key", nullable = false, length = 200)
    private String scopeKey;

    @Column(nullable = false)
    private int period;

    @Column(nullable = false)
    private double p25;

    @Column(nullable = false)
    private double median;

    @Column(nullable = false)
    private double p75;

    @Column(nullable = false)
    private double mean;

    @Column(name = "sample_count", nullable = false)
    private int sampleCount;
}
