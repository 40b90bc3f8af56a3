package com.reactloop.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One tool invocation requested by the model during a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Loop step (1-based) in which the model asked for the call */
    private int step;

    private String toolName;

    private Map<String, Object> arguments;

    /** False when the registry reported an unknown tool, bad arguments or a handler failure */
    private boolean succeeded;
}
