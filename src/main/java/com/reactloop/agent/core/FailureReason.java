package com.reactloop.agent.core;

import com.reactloop.agent.exception.AuthException;
import com.reactloop.agent.exception.BadRequestException;
import com.reactloop.agent.exception.RateLimitException;
import com.reactloop.agent.exception.TransientUnavailableException;

/**
 * Why a run ended in {@link LoopStatus#FATAL_ERROR}.
 */
public enum FailureReason {

    /** Caller requested cancellation between steps */
    CANCELLED,
    AUTH,
    RATE_LIMITED,
    BAD_REQUEST,
    /** Retryable failures persisted through every attempt */
    UNAVAILABLE,
    /** Anything else the LLM client raised */
    LLM_ERROR;

    public static FailureReason of(Throwable llmFailure) {
        if (llmFailure instanceof AuthException) return AUTH;
        if (llmFailure instanceof RateLimitException) return RATE_LIMITED;
        if (llmFailure instanceof BadRequestException) return BAD_REQUEST;
        if (llmFailure instanceof TransientUnavailableException) return UNAVAILABLE;
        return LLM_ERROR;
    }
}
