package com.reactloop.agent.tool;

/**
 * Immutable registry entry: what the model sees (name, description, schema)
 * plus the handler that runs the call.
 */
public record ToolSpec(String name, String description, ArgumentSchema schema, ToolHandler handler) {

    public ToolSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Tool '" + name + "' has no handler");
        }
        description = description != null ? description : "";
        schema = schema != null ? schema : ArgumentSchema.empty();
    }

    public static ToolSpec from(AgentTool tool) {
        return new ToolSpec(tool.getName(), tool.getDescription(), tool.getArgumentSchema(), tool::execute);
    }
}
