package com.reactloop.agent.core;

import com.reactloop.agent.model.ToolCall;
import com.reactloop.agent.model.Transcript;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.Setter;

import java.util.List;

/**
 * Holds all mutable state for a single agent run.
 * Passed through the ReAct loop instead of scattered fields on AgentLoop, which is a
 * shared singleton.
 */
@Data
@Builder
public class AgentContext {

    private String runId;
    private String task;
    private Transcript transcript;
    private List<ToolCall> executedToolCalls;
    private int currentStep;

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private AgentState state = AgentState.RUNNING;

    /**
     * Moves to the given state. Terminal states are final.
     */
    public void transitionTo(AgentState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already ended in " + state + ", cannot move to " + next);
        }
        state = next;
    }
}
