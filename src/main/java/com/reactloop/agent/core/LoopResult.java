package com.reactloop.agent.core;

import com.reactloop.agent.model.Message;
import com.reactloop.agent.model.ToolCall;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one agent run. Always carries the full transcript so the reasoning trace
 * can be reconstructed whatever the status.
 */
@Value
@Builder
public class LoopResult {

    LoopStatus status;

    String answer;

    List<Message> transcript;

    @Builder.Default
    List<ToolCall> toolCalls = List.of();

    int stepsUsed;

    /** Non-null only for FATAL_ERROR */
    FailureReason failureReason;

    String errorMessage;

    public Optional<String> getAnswer() {
        return Optional.ofNullable(answer);
    }

    public boolean isSuccess() {
        return status == LoopStatus.SUCCESS;
    }
}
