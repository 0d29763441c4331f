package com.kpibench.domain.exception;

/**
 * Malformed KPI catalog or scope configuration.
 *
 * Raised while the catalog is assembled at startup, so the application
 * never begins serving with an inconsistent KPI tree.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
