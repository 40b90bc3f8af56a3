package com.reactloop.agent.tool;

import java.util.Map;

/**
 * The callable behind a tool. Arguments have already been validated against the tool's schema.
 * Any exception thrown here is wrapped by the registry and reported back to the model.
 */
@FunctionalInterface
public interface ToolHandler {

    Object handle(Map<String, Object> arguments) throws Exception;
}
