package com.reactloop.agent.core;

public enum LoopStatus {
    SUCCESS,
    STEP_LIMIT_EXCEEDED,
    FATAL_ERROR
}
