package com.reactloop.agent.exception;

/**
 * Every retry attempt failed with a retryable error. The cause is the last failure seen.
 */
public class TransientUnavailableException extends LlmException {

    private final int attempts;

    public TransientUnavailableException(String message, int attempts, Throwable lastCause) {
        super(message, lastCause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
