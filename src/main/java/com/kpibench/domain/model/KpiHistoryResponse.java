package com.kpibench.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response model for an entity's KPI values across every reported period.
 *
 * periods is ordered oldest first; each value map keeps catalog order.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KpiHistoryResponse {

    private String entityId;
    private Map<Integer, Map<String, Double>> periods;
    private AccessMode provenance;
    private boolean dataAvailable;
    private Long generation;
    private boolean cached;
    private long queryTimeMs;
}
