package com.kpibench.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class CapabilitySnapshot {

    AccessMode kpiMode;
    AccessMode benchmarkMode;
    Long generationId;
    Instant detectedAt;

    public AccessMode modeFor(QueryKind kind) {
        return kind == QueryKind.KPI_VALUES ? kpiMode : benchmarkMode;
    }
}
