package com.duckmart.segment.exception;

/**
 * Exception thrown when the compiler meets a validated predicate its schema
 * cannot express, such as a field the validator accepted but the compiler's
 * whitelist lacks.
 *
 * <p>This signals an inconsistency between components rather than a bad request.
 * Callers should treat it as an internal fault.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
