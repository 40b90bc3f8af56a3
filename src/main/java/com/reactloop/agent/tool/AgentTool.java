package com.reactloop.agent.tool;

import java.util.Map;

/**
 * Contract for tools contributed as Spring beans.
 *
 * Every bean implementing this interface is registered in the {@link ToolRegistry} at start-up.
 * Tools do not need to catch their own errors: the registry wraps anything thrown from
 * {@link #execute(Map)} and the loop reports it to the model as an observation.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses in the action block */
    String getName();

    /** Shown to the model in the system prompt. Say what the tool does and when to use it. */
    String getDescription();

    ArgumentSchema getArgumentSchema();

    /**
     * Runs the tool. Arguments already passed schema validation.
     *
     * @return the result value; rendered into the observation text by the loop
     */
    Object execute(Map<String, Object> arguments) throws Exception;
}
