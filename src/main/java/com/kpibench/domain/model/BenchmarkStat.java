package com.kpibench.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Percentile statistics of one KPI for one peer group and period.
 *
 * Only produced for partitions with at least one sample, so
 * p25 <= median <= p75 always holds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkStat {

    private String kpiKey;
    private String scope;
    private String scopeKey;
    private int period;

    private double p25;
    private double median;
    private double p75;
    private double mean;
    private int sampleCount;
}
