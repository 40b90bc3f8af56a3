package com.reactloop.agent.exception;

/** The tool handler itself threw. Carries the original cause. */
public class ToolExecutionException extends ToolException {

    public ToolExecutionException(String toolName, Throwable cause) {
        super(toolName, String.format("Tool '%s' failed: %s", toolName,
                cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
    }
}
