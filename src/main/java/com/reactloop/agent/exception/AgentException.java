package com.reactloop.agent.exception;

/**
 * Root of every failure raised by the agent core.
 * Unchecked so that the loop and the HTTP layer decide where to absorb it.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
