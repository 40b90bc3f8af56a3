package com.reactloop.agent.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reactloop.agent.exception.AgentException;
import com.reactloop.agent.parser.ResponseParser;
import com.reactloop.agent.tool.ToolRegistry;
import com.reactloop.agent.tool.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the system prompt: the ReAct reply protocol the parser expects, plus one line
 * per registered tool.
 */
@Component
public class SystemPromptBuilder {

    private static final String TEMPLATE = """
            You are a tool-using assistant. Solve the user's task step by step following the ReAct pattern.

            ## Reply format
            1. Thought: describe your reasoning and which tool you will use next.
            2. Action: when you need a tool, output exactly one JSON object wrapped in %1$s and %2$s:
               {"tool": "<tool name>", "args": {<argument name>: <value>, ...}}
            3. Observation: the tool result is sent back to you. Use it in your next Thought.

            ## Rules
            - Every reply starts with a Thought.
            - Request at most one Action per reply, then stop and wait for the Observation.
            - When the task is complete, reply with a line starting with '%3$s' followed by the result.
            - Never put an Action and a Final Answer in the same reply.
            - If an Observation reports an ERROR, fix the call or choose another approach.

            ## Available tools
            %4$s

            ## Example replies
            Thought: I need the sum of two numbers, so I will use add_numbers.
            %1$s
            {"tool": "add_numbers", "args": {"a": 123, "b": 456}}
            %2$s

            Thought: I have the result and can answer.
            %3$s 579
            """;

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    public SystemPromptBuilder(ToolRegistry toolRegistry, ObjectMapper objectMapper) {
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
    }

    public String build() {
        String tools = toolRegistry.getAllSpecs().stream()
                .map(this::describe)
                .collect(Collectors.joining("\n"));

        return String.format(TEMPLATE,
                ResponseParser.ACTION_START,
                ResponseParser.ACTION_END,
                ResponseParser.FINAL_ANSWER_MARKER,
                tools.isEmpty() ? "(none)" : tools);
    }

    private String describe(ToolSpec spec) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("tool", spec.name());
        entry.put("description", spec.description());
        entry.put("args", spec.schema().toPromptSignature());
        try {
            return "- " + objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new AgentException("Could not render tool '" + spec.name() + "' for the system prompt", e);
        }
    }
}
