package com.reactloop.agent.exception;

import java.util.Set;

public class UnknownToolException extends ToolException {

    public UnknownToolException(String toolName, Set<String> availableTools) {
        super(toolName, String.format("Unknown tool '%s'. Available tools: %s",
                toolName, availableTools.stream().sorted().toList()));
    }
}
