package com.reactloop.agent.resilience;

import com.reactloop.agent.exception.RateLimitException;
import com.reactloop.agent.exception.TransportException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private static final TransportException TIMEOUT = new TransportException("timed out", (Throwable) null);

    @Test
    void delay_doublesPerAttempt() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.0);

        assertThat(policy.delayMillis(1, TIMEOUT)).isEqualTo(1000);
        assertThat(policy.delayMillis(2, TIMEOUT)).isEqualTo(2000);
        assertThat(policy.delayMillis(3, TIMEOUT)).isEqualTo(4000);
    }

    @Test
    void delay_isCappedAtMax() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8), 0.0);

        assertThat(policy.delayMillis(5, TIMEOUT)).isEqualTo(8000);
        assertThat(policy.delayMillis(40, TIMEOUT)).isEqualTo(8000);
    }

    @Test
    void jitter_addsFractionOfDelay() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8), 0.2, () -> 0.5);

        assertThat(policy.delayMillis(2, TIMEOUT)).isEqualTo(2000 + 200);
    }

    @Test
    void jitter_staysWithinBound() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8), 0.2);

        for (int i = 0; i < 50; i++) {
            assertThat(policy.delayMillis(1, TIMEOUT)).isBetween(1000L, 1200L);
        }
    }

    @Test
    void retryAfterHint_overridesComputedDelay() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8), 0.2, () -> 0.9);
        RateLimitException rateLimited = new RateLimitException("slow down", Duration.ofSeconds(30));

        assertThat(policy.delayMillis(1, rateLimited)).isEqualTo(30_000);
    }

    @Test
    void honours_onlyHintsWithinCap() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8), 0.0, Duration.ofSeconds(60));

        assertThat(policy.honours(Duration.ofSeconds(60))).isTrue();
        assertThat(policy.honours(Duration.ofSeconds(61))).isFalse();
        assertThat(policy.honours(Duration.ofDays(1))).isFalse();
        assertThat(policy.honours(null)).isFalse();
    }

    @Test
    void retryAfterHint_neverWaitsPastCap() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8), 0.0, Duration.ofSeconds(60));

        assertThat(policy.delayMillis(1, new RateLimitException("slow down", Duration.ofDays(1)))).isEqualTo(60_000);
    }

    @Test
    void constructor_rejectsMaxBelowBase() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsNegativeJitter() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
