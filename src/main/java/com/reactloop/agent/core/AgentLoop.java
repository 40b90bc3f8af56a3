package com.reactloop.agent.core;

import com.reactloop.agent.config.AgentProperties;
import com.reactloop.agent.exception.LlmException;
import com.reactloop.agent.exception.ToolException;
import com.reactloop.agent.exception.ToolExecutionException;
import com.reactloop.agent.llm.LlmClient;
import com.reactloop.agent.llm.LlmOptions;
import com.reactloop.agent.model.Message;
import com.reactloop.agent.model.ToolCall;
import com.reactloop.agent.model.Transcript;
import com.reactloop.agent.observability.RunContext;
import com.reactloop.agent.parser.ParsedReply;
import com.reactloop.agent.parser.ResponseParser;
import com.reactloop.agent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Core ReAct (Reason → Act → Observe) agent loop.
 *
 * Per-step flow:
 * 1. Stop if cancellation was requested or the step budget is spent
 * 2. Send the transcript to the LLM; an LLM failure ends the run
 * 3. Append the raw reply and parse it
 * 4. Final answer ends the run; an action runs through the tool registry; a malformed
 *    reply gets a format correction. Tool and format problems become observations so the
 *    model can correct itself, and the loop continues.
 *
 * The bean is shared; everything specific to a run lives in its {@link AgentContext}.
 */
@Service
@Slf4j
public class AgentLoop {

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;
    private final ResponseParser responseParser;
    private final SystemPromptBuilder systemPromptBuilder;
    private final ObservationFormatter observationFormatter;
    private final AgentProperties agentProperties;
    private final LlmOptions llmOptions;

    public AgentLoop(LlmClient llmClient,
                     ToolRegistry toolRegistry,
                     ResponseParser responseParser,
                     SystemPromptBuilder systemPromptBuilder,
                     ObservationFormatter observationFormatter,
                     AgentProperties agentProperties,
                     LlmOptions llmOptions) {
        this.llmClient = llmClient;
        this.toolRegistry = toolRegistry;
        this.responseParser = responseParser;
        this.systemPromptBuilder = systemPromptBuilder;
        this.observationFormatter = observationFormatter;
        this.agentProperties = agentProperties;
        this.llmOptions = llmOptions;
    }

    public LoopResult run(String task) {
        return run(task, CancellationToken.create());
    }

    public LoopResult run(String task, CancellationToken cancellation) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        log.info("Agent run started [runId={}, task='{}']", runId, task);

        AgentContext context = AgentContext.builder()
                .runId(runId)
                .task(task)
                .transcript(Transcript.start(systemPromptBuilder.build(), task))
                .executedToolCalls(new ArrayList<>())
                .currentStep(0)
                .build();
        RunContext runCtx = new RunContext();

        LoopResult result = executeLoop(context, runCtx, cancellation);

        log.info("Agent run complete [runId={}, status={}, steps={}, latency={}ms, llmLatency={}ms, "
                        + "toolCalls={}, failedToolCalls={}, malformedReplies={}]",
                runId, result.getStatus(), result.getStepsUsed(), runCtx.elapsedMs(), runCtx.getLlmLatencyMs(),
                runCtx.getToolCalls(), runCtx.getFailedToolCalls(), runCtx.getMalformedReplies());
        return result;
    }

    private LoopResult executeLoop(AgentContext context, RunContext runCtx, CancellationToken cancellation) {
        int maxSteps = agentProperties.getMaxSteps();

        while (true) {
            if (cancellation.isCancelled()) {
                log.warn("Agent run cancelled before step {} [runId={}]", context.getCurrentStep() + 1, context.getRunId());
                return fail(context, FailureReason.CANCELLED, "Run cancelled by caller");
            }
            if (context.getCurrentStep() >= maxSteps) {
                log.warn("Agent hit max steps ({}) [runId={}]", maxSteps, context.getRunId());
                context.transitionTo(AgentState.EXHAUSTED);
                return result(context, LoopStatus.STEP_LIMIT_EXCEEDED).build();
            }

            int step = context.getCurrentStep() + 1;
            context.setCurrentStep(step);
            log.info("Agent step {}/{} [runId={}]", step, maxSteps, context.getRunId());

            String reply;
            long llmStart = System.currentTimeMillis();
            try {
                reply = llmClient.complete(context.getTranscript().getMessages(), llmOptions);
            } catch (LlmException e) {
                log.error("LLM call failed at step {} [runId={}]: {}", step, context.getRunId(), e.getMessage());
                return fail(context, FailureReason.of(e), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected LLM client failure at step {} [runId={}]", step, context.getRunId(), e);
                return fail(context, FailureReason.LLM_ERROR, e.getMessage());
            } finally {
                runCtx.recordLlmCall(System.currentTimeMillis() - llmStart);
            }

            context.getTranscript().append(Message.assistant(reply));
            ParsedReply parsed = responseParser.parse(reply);

            if (parsed instanceof ParsedReply.FinalAnswer finalAnswer) {
                context.transitionTo(AgentState.SUCCEEDED);
                return result(context, LoopStatus.SUCCESS)
                        .answer(finalAnswer.answer())
                        .build();
            }

            String observation;
            if (parsed instanceof ParsedReply.Action action) {
                observation = executeAction(context, runCtx, action);
            } else {
                ParsedReply.Malformed malformed = (ParsedReply.Malformed) parsed;
                log.warn("Malformed reply at step {} [runId={}]: {}", step, context.getRunId(), malformed.reason());
                runCtx.recordMalformedReply();
                observation = observationFormatter.formatCorrection(malformed);
            }
            context.getTranscript().append(Message.observation(observation));
        }
    }

    private String executeAction(AgentContext context, RunContext runCtx, ParsedReply.Action action) {
        log.info("LLM requested tool: [{}] [runId={}]", action.toolName(), context.getRunId());

        long toolStart = System.currentTimeMillis();
        boolean succeeded = false;
        try {
            Object result = toolRegistry.invoke(action.toolName(), action.arguments());
            String observation = observationFormatter.result(result);
            succeeded = true;
            return observation;
        } catch (ToolException e) {
            log.warn("Tool call failed at step {} [runId={}]: {}", context.getCurrentStep(), context.getRunId(), e.getMessage());
            return observationFormatter.toolError(e);
        } catch (RuntimeException e) {
            // The result's toString() or serialization blew up
            log.warn("Could not render result of tool [{}] at step {} [runId={}]", action.toolName(),
                    context.getCurrentStep(), context.getRunId(), e);
            return observationFormatter.toolError(new ToolExecutionException(action.toolName(), e));
        } finally {
            runCtx.recordToolCall(System.currentTimeMillis() - toolStart, succeeded);
            context.getExecutedToolCalls().add(ToolCall.builder()
                    .step(context.getCurrentStep())
                    .toolName(action.toolName())
                    .arguments(action.arguments())
                    .succeeded(succeeded)
                    .build());
        }
    }

    private LoopResult fail(AgentContext context, FailureReason reason, String message) {
        context.transitionTo(AgentState.FAILED);
        return result(context, LoopStatus.FATAL_ERROR)
                .failureReason(reason)
                .errorMessage(message)
                .build();
    }

    private LoopResult.LoopResultBuilder result(AgentContext context, LoopStatus status) {
        return LoopResult.builder()
                .status(status)
                .transcript(context.getTranscript().snapshot())
                .toolCalls(List.copyOf(context.getExecutedToolCalls()))
                .stepsUsed(context.getCurrentStep());
    }
}
