package com.reactloop.agent.exception;

public class DuplicateToolException extends ToolException {

    public DuplicateToolException(String toolName) {
        super(toolName, "Tool '" + toolName + "' is already registered");
    }
}
