package com.reactloop.agent.exception;

import java.util.OptionalInt;

/**
 * Connection error, timeout or 5xx response. Always retryable.
 */
public class TransportException extends LlmException {

    private final Integer statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status of a 5xx response, empty for network-level failures */
    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
