package com.reactloop.agent.exception;

/**
 * Failure while talking to the LLM provider.
 *
 * Thrown as-is when the provider answered 2xx with a body the client cannot use;
 * the subclasses classify transport and client-side failures.
 */
public class LlmException extends AgentException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
