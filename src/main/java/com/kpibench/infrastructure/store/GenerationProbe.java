package com.kpibench.infrastructure.store;

import lombok.Value;

/**
 * Result of checking the published generation's tables.
 *
 * generationId is null when no generation has been published yet.
 * Each table flag is true only when the table could be read and holds
 * exactly the row count the build recorded for it.
 */
@Value
public class GenerationProbe {

    Long generationId;
    boolean kpiValuesReadable;
    boolean benchmarkStatsReadable;

    public static GenerationProbe none() {
        return new GenerationProbe(null, false, false);
    }

    public boolean hasGeneration() {
        return generationId != null;
    }
}
