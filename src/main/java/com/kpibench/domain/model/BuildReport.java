package com.kpibench.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one build run, as reported to the admin caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildReport {

    private Long generationId;
    private boolean succeeded;
    private long kpiValueCount;
    private long benchmarkStatCount;
    private long elapsedMs;

    // Failure details
    private BuildStage failedStage;
    private String failedSubject;
    private String message;

    public int exitCode() {
        return succeeded ? 0 : 1;
    }
}
