package com.kpibench.domain.exception;

/**
 * An on-the-fly computation noticed its caller gave up and stopped.
 */
public class ComputationCancelledException extends RuntimeException {

    public ComputationCancelledException(String stage) {
        super("Computation cancelled at " + stage);
    }

    /**
     * Throws when the current thread has been interrupted.
     */
    public static void checkpoint(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ComputationCancelledException(stage);
        }
    }
}
