package com.reactloop.agent.tool.impl;

import com.reactloop.agent.tool.AgentTool;
import com.reactloop.agent.tool.ArgumentSchema;
import com.reactloop.agent.tool.ArgumentType;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Smoke-test tool to verify the tool system wires up correctly.
 * Lets the loop be exercised end-to-end without depending on any real capability.
 */
@Component
public class EchoTool implements AgentTool {

    private static final ArgumentSchema SCHEMA = ArgumentSchema.builder()
            .required("message", ArgumentType.STRING, "The message to echo back")
            .build();

    @Override
    public String getName() {
        return "echo";
    }

    @Override
    public String getDescription() {
        return "Echoes back the provided message. Use this to test the tool system is working.";
    }

    @Override
    public ArgumentSchema getArgumentSchema() {
        return SCHEMA;
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        return "Echo: " + arguments.get("message");
    }
}
