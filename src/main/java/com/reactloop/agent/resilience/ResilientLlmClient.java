package com.reactloop.agent.resilience;

import com.reactloop.agent.exception.LlmException;
import com.reactloop.agent.exception.RateLimitException;
import com.reactloop.agent.exception.TransientUnavailableException;
import com.reactloop.agent.exception.TransportException;
import com.reactloop.agent.llm.LlmClient;
import com.reactloop.agent.llm.LlmOptions;
import com.reactloop.agent.model.Message;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the provider client that adds retry with backoff.
 *
 * GenericLlmClient performs a single exchange; this bean is @Primary, so AgentLoop
 * always receives the retrying client.
 *
 * Retry policy:
 * - Up to {@link LlmOptions#getMaxRetries()} attempts in total
 * - Retries TransportException (network, timeout, 5xx) and RateLimitException whose Retry-After
 *   hint is within the policy's cap
 * - Auth, bad-request and hint-less rate-limit failures are rethrown at once
 * - Wait between attempts comes from {@link BackoffPolicy}
 * - Exhaustion surfaces as TransientUnavailableException with the last failure as cause
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;
    private final BackoffPolicy backoffPolicy;

    public ResilientLlmClient(@Qualifier("providerLlmClient") LlmClient delegate, BackoffPolicy backoffPolicy) {
        this.delegate = delegate;
        this.backoffPolicy = backoffPolicy;
    }

    @Override
    public String complete(List<Message> transcript, LlmOptions options) {
        int maxAttempts = options.getMaxRetries();

        RetryConfig config = RetryConfig.<String>custom()
                .maxAttempts(maxAttempts)
                .retryOnException(this::isRetryable)
                .intervalBiFunction((attempt, outcome) ->
                        backoffPolicy.delayMillis(attempt, outcome.isLeft() ? outcome.getLeft() : null))
                .build();

        Retry retry = Retry.of("llmClient", config);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "LLM call failed (attempt {}/{}), retrying in {}ms: {}",
                event.getNumberOfRetryAttempts(), maxAttempts,
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        try {
            return retry.executeSupplier(() -> delegate.complete(transcript, options));
        } catch (LlmException e) {
            if (isRetryable(e)) {
                log.error("LLM call failed after {} attempts: {}", maxAttempts, e.getMessage());
                throw new TransientUnavailableException(
                        "LLM unavailable after " + maxAttempts + " attempt(s): " + e.getMessage(), maxAttempts, e);
            }
            log.error("LLM call failed without retry: {}", e.getMessage());
            throw e;
        }
    }

    boolean isRetryable(Throwable t) {
        if (t instanceof TransportException) {
            return true;
        }
        return t instanceof RateLimitException rateLimit
                && rateLimit.getRetryAfter().filter(backoffPolicy::honours).isPresent();
    }
}
