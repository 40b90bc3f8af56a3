package com.reactloop.agent.exception;

/** Any 4xx other than auth and rate-limit failures. Never retried. */
public class BadRequestException extends LlmException {

    private final int statusCode;

    public BadRequestException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
