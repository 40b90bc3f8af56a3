package com.reactloop.agent.resilience;

import com.reactloop.agent.exception.RateLimitException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Wait time before the next LLM attempt.
 *
 * Exponential: base, 2x base, 4x base ... capped at max, plus up to {@code jitter} x that delay
 * of random extra wait so that concurrent runs hitting the same outage do not retry in lockstep.
 * A rate-limit failure that carried a Retry-After hint overrides the computation for that retry,
 * as long as the hint is within {@code retryAfterMax}; longer hints are not waited on at all.
 */
public class BackoffPolicy {

    public static final Duration DEFAULT_RETRY_AFTER_MAX = Duration.ofSeconds(60);

    private final long baseMillis;
    private final long maxMillis;
    private final double jitter;
    private final long retryAfterMaxMillis;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration max, double jitter) {
        this(base, max, jitter, DEFAULT_RETRY_AFTER_MAX);
    }

    public BackoffPolicy(Duration base, Duration max, double jitter, Duration retryAfterMax) {
        this(base, max, jitter, retryAfterMax, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(Duration base, Duration max, double jitter, DoubleSupplier random) {
        this(base, max, jitter, DEFAULT_RETRY_AFTER_MAX, random);
    }

    /**
     * @param retryAfterMax longest Retry-After hint that is still waited on
     * @param random        source of values in [0, 1); injectable so tests get deterministic delays
     */
    public BackoffPolicy(Duration base, Duration max, double jitter, Duration retryAfterMax, DoubleSupplier random) {
        if (base.isNegative() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("backoff requires 0 <= base <= max, got base=" + base + " max=" + max);
        }
        if (jitter < 0.0) {
            throw new IllegalArgumentException("jitter must not be negative, got " + jitter);
        }
        this.baseMillis = base.toMillis();
        this.maxMillis = max.toMillis();
        if (retryAfterMax == null || retryAfterMax.isNegative()) {
            throw new IllegalArgumentException("retryAfterMax must not be negative, got " + retryAfterMax);
        }
        this.jitter = jitter;
        this.retryAfterMaxMillis = retryAfterMax.toMillis();
        this.random = random;
    }

    /**
     * Whether a Retry-After hint is short enough to wait for. The run checks for cancellation
     * only between steps, so an unbounded hint would block it.
     */
    public boolean honours(Duration retryAfter) {
        return retryAfter != null && !retryAfter.isNegative() && retryAfter.toMillis() <= retryAfterMaxMillis;
    }

    /**
     * @param attempt number of the attempt that just failed, starting at 1
     * @param failure what that attempt failed with, may be null
     */
    public long delayMillis(int attempt, Throwable failure) {
        if (failure instanceof RateLimitException rateLimit && rateLimit.getRetryAfter().isPresent()) {
            return Math.min(rateLimit.getRetryAfter().get().toMillis(), retryAfterMaxMillis);
        }
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long exponential = Math.min(maxMillis, baseMillis << exponent);
        if (exponential < 0) {
            exponential = maxMillis;
        }
        long extra = (long) (exponential * jitter * random.getAsDouble());
        return exponential + extra;
    }
}
