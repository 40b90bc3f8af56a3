package com.reactloop.agent.exception;

/** Provider rejected the credentials (401/403). Never retried. */
public class AuthException extends LlmException {

    public AuthException(String message) {
        super(message);
    }
}
