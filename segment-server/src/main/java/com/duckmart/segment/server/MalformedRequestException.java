package com.duckmart.segment.server;

/**
 * Exception thrown when a request body is not JSON or does not have the request shape.
 *
 * <p>Distinct from {@link com.duckmart.segment.exception.ValidationException}, which
 * reports well-formed requests with invalid filters.
 */
public class MalformedRequestException extends RuntimeException {

    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
