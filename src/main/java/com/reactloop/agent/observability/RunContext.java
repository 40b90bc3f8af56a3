package com.reactloop.agent.observability;

import lombok.Data;

/**
 * Mutable per-run timing collected while the loop executes and logged when it ends.
 * Conversation state lives in AgentContext.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();

    private int llmCalls;
    private long llmLatencyMs;

    private int toolCalls;
    private int failedToolCalls;
    private long toolLatencyMs;

    private int malformedReplies;

    public void recordLlmCall(long latencyMs) {
        llmCalls++;
        llmLatencyMs += latencyMs;
    }

    public void recordToolCall(long latencyMs, boolean succeeded) {
        toolCalls++;
        toolLatencyMs += latencyMs;
        if (!succeeded) {
            failedToolCalls++;
        }
    }

    public void recordMalformedReply() {
        malformedReplies++;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }
}
