package com.kpibench.domain.exception;

import com.kpibench.domain.model.BuildStage;
import lombok.Getter;

/**
 * A build stage failed. Carries the stage and the entity, KPI or scope
 * being processed when it happened.
 */
@Getter
public class BuildFailureException extends RuntimeException {

    private final BuildStage stage;
    private final String subject;

    public BuildFailureException(BuildStage stage, String subject, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.subject = subject;
    }

    public BuildFailureException(BuildStage stage, String subject, String message) {
        this(stage, subject, message, null);
    }
}
