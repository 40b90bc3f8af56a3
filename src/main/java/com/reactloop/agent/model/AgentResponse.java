package com.reactloop.agent.model;

import com.reactloop.agent.core.FailureReason;
import com.reactloop.agent.core.LoopResult;
import com.reactloop.agent.core.LoopStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {

    private LoopStatus status;

    private String finalAnswer;

    private int stepsUsed;

    /** Set only when status is FATAL_ERROR */
    private FailureReason failureReason;

    private String errorMessage;

    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    @Builder.Default
    private List<Message> transcript = new ArrayList<>();

    public static AgentResponse from(LoopResult result) {
        return AgentResponse.builder()
                .status(result.getStatus())
                .finalAnswer(result.getAnswer().orElse(null))
                .stepsUsed(result.getStepsUsed())
                .failureReason(result.getFailureReason())
                .errorMessage(result.getErrorMessage())
                .toolCalls(result.getToolCalls())
                .transcript(result.getTranscript())
                .build();
    }
}
