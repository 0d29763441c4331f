package com.kpibench.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response model for per-entity KPI queries.
 *
 * values keeps catalog order and carries null for KPIs that could not
 * be computed. dataAvailable is false when nothing could be served
 * (unknown entity/period or storage unavailable); provenance tells which.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KpiQueryResponse {

    private String entityId;
    private int period;
    private Map<String, Double> values;
    private AccessMode provenance;
    private boolean dataAvailable;
    private Long generation;
    private boolean cached;
    private long queryTimeMs;
}
