package com.kpibench.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response model for a single peer-group benchmark lookup.
 *
 * stat is null when the partition had no samples or nothing could be
 * served; it is never a zero-filled placeholder.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkQueryResponse {

    private String kpiKey;
    private String scope;
    private String scopeKey;
    private int period;
    private BenchmarkStat stat;
    private AccessMode provenance;
    private Long generation;
    private boolean cached;
    private long queryTimeMs;

    public boolean isPresent() {
        return stat != null;
    }
}
