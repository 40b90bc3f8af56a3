package com.reactloop.agent.core;

public enum AgentState {

    RUNNING,
    SUCCEEDED,
    EXHAUSTED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
