package com.reactloop.agent.exception;

/**
 * Failure in the tool layer. The agent loop turns these into observations
 * so the model can correct itself; they never end a run.
 */
public class ToolException extends AgentException {

    private final String toolName;

    public ToolException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public ToolException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
