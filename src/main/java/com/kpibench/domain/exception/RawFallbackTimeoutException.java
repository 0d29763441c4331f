package com.kpibench.domain.exception;

public class RawFallbackTimeoutException extends RuntimeException {

    public RawFallbackTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
