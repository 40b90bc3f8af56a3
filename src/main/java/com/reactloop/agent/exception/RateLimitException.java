package com.reactloop.agent.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * 429 from the provider. Retried only when the response carried a Retry-After hint.
 */
public class RateLimitException extends LlmException {

    private final Duration retryAfter;

    public RateLimitException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
