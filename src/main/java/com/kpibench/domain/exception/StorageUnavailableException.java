package com.kpibench.domain.exception;

/**
 * The line-item store or the precomputed tables could not be read.
 *
 * Recoverable: the capability detector downgrades and retries lazily.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
