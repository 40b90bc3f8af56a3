package com.reactloop.agent.resilience;

import com.reactloop.agent.exception.AuthException;
import com.reactloop.agent.exception.BadRequestException;
import com.reactloop.agent.exception.RateLimitException;
import com.reactloop.agent.exception.TransientUnavailableException;
import com.reactloop.agent.exception.TransportException;
import com.reactloop.agent.llm.LlmClient;
import com.reactloop.agent.llm.LlmOptions;
import com.reactloop.agent.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResilientLlmClientTest {

    private static final List<Message> TRANSCRIPT = List.of(Message.system("sys"), Message.user("Compute 1 + 1"));

    @Mock
    private LlmClient delegate;

    private ResilientLlmClient client;
    private LlmOptions options;

    @BeforeEach
    void setUp() {
        client = new ResilientLlmClient(delegate,
                new BackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(4), 0.0, Duration.ofSeconds(30)));
        options = LlmOptions.builder()
                .temperature(0.1)
                .maxOutputTokens(256)
                .modelId("test-model")
                .timeout(Duration.ofSeconds(5))
                .maxRetries(3)
                .build();
    }

    @Test
    void complete_transportFailureThenSuccess_returnsReply() {
        when(delegate.complete(anyList(), any()))
                .thenThrow(new TransportException("connection reset", (Throwable) null))
                .thenReturn("Final Answer: 2");

        assertThat(client.complete(TRANSCRIPT, options)).isEqualTo("Final Answer: 2");
        verify(delegate, times(2)).complete(TRANSCRIPT, options);
    }

    @Test
    void complete_transportFailuresExhaustAttempts_throwsTransientUnavailable() {
        TransportException last = new TransportException("server error [503]", 503);
        when(delegate.complete(anyList(), any()))
                .thenThrow(new TransportException("server error [502]", 502))
                .thenThrow(new TransportException("timed out", (Throwable) null))
                .thenThrow(last);

        assertThatThrownBy(() -> client.complete(TRANSCRIPT, options))
                .isInstanceOf(TransientUnavailableException.class)
                .hasCause(last)
                .satisfies(e -> assertThat(((TransientUnavailableException) e).getAttempts()).isEqualTo(3));
        verify(delegate, times(3)).complete(anyList(), any());
    }

    @Test
    void complete_authFailure_notRetried() {
        when(delegate.complete(anyList(), any())).thenThrow(new AuthException("bad key"));

        assertThatThrownBy(() -> client.complete(TRANSCRIPT, options)).isInstanceOf(AuthException.class);
        verify(delegate, times(1)).complete(anyList(), any());
    }

    @Test
    void complete_badRequest_notRetried() {
        when(delegate.complete(anyList(), any())).thenThrow(new BadRequestException("context too long", 400));

        assertThatThrownBy(() -> client.complete(TRANSCRIPT, options)).isInstanceOf(BadRequestException.class);
        verify(delegate, times(1)).complete(anyList(), any());
    }

    @Test
    void complete_rateLimitWithoutHint_failsImmediately() {
        when(delegate.complete(anyList(), any())).thenThrow(new RateLimitException("429", null));

        assertThatThrownBy(() -> client.complete(TRANSCRIPT, options)).isInstanceOf(RateLimitException.class);
        verify(delegate, times(1)).complete(anyList(), any());
    }

    @Test
    void complete_rateLimitWithHint_retriedAfterHint() {
        when(delegate.complete(anyList(), any()))
                .thenThrow(new RateLimitException("429", Duration.ofMillis(5)))
                .thenReturn("Final Answer: ok");

        assertThat(client.complete(TRANSCRIPT, options)).isEqualTo("Final Answer: ok");
        verify(delegate, times(2)).complete(anyList(), any());
    }

    @Test
    void complete_rateLimitHintBeyondCap_failsImmediately() {
        RateLimitException dayLong = new RateLimitException("429", Duration.ofSeconds(86_400));
        when(delegate.complete(anyList(), any())).thenThrow(dayLong);

        assertThatThrownBy(() -> client.complete(TRANSCRIPT, options)).isSameAs(dayLong);
        verify(delegate, times(1)).complete(anyList(), any());
    }

    @Test
    void complete_singleAttemptBudget_noRetry() {
        when(delegate.complete(anyList(), any())).thenThrow(new TransportException("down", (Throwable) null));

        assertThatThrownBy(() -> client.complete(TRANSCRIPT, options.toBuilder().maxRetries(1).build()))
                .isInstanceOf(TransientUnavailableException.class);
        verify(delegate, times(1)).complete(anyList(), any());
    }

    @Test
    void isRetryable_classifiesFailures() {
        assertThat(client.isRetryable(new TransportException("x", 500))).isTrue();
        assertThat(client.isRetryable(new RateLimitException("x", Duration.ofSeconds(1)))).isTrue();
        assertThat(client.isRetryable(new RateLimitException("x", Duration.ofSeconds(31)))).isFalse();
        assertThat(client.isRetryable(new RateLimitException("x", null))).isFalse();
        assertThat(client.isRetryable(new AuthException("x"))).isFalse();
    }
}
