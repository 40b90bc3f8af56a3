package com.reactloop.agent.tool;

import com.reactloop.agent.exception.ArgumentValidationException;
import com.reactloop.agent.exception.DuplicateToolException;
import com.reactloop.agent.exception.ToolExecutionException;
import com.reactloop.agent.exception.UnknownToolException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central registry of the tools the model may call.
 *
 * Built once through {@link Builder} and immutable afterwards, so a single instance
 * is shared by every concurrent agent run without locking. Handlers that mutate shared
 * state are responsible for their own thread-safety.
 *
 * {@link #invoke(String, Map)} never lets a handler failure escape unwrapped, Errors included
 * (OutOfMemoryError aside): callers only ever see the {@code ToolException} family.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolSpec> tools;

    private ToolRegistry(Map<String, ToolSpec> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static Builder builder() {
        return new Builder();
    }

    public ToolSpec lookup(String name) {
        ToolSpec spec = name != null ? tools.get(name) : null;
        if (spec == null) {
            throw new UnknownToolException(name, tools.keySet());
        }
        return spec;
    }

    /**
     * Validates the arguments and runs the named tool.
     *
     * @throws UnknownToolException        no tool with that name; nothing was executed
     * @throws ArgumentValidationException arguments violate the schema; the handler was not called
     * @throws ToolExecutionException      the handler threw; the original throwable is the cause
     */
    public Object invoke(String name, Map<String, Object> arguments) {
        ToolSpec spec = lookup(name);
        Map<String, Object> args = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();

        Map<String, String> violations = spec.schema().validate(args);
        if (!violations.isEmpty()) {
            throw new ArgumentValidationException(name, violations);
        }

        log.info("Executing tool: [{}] with args: {}", name, args);

        try {
            Object result = spec.handler().handle(args);
            log.debug("Tool [{}] returned: {}", name, result);
            return result;
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            // Errors too: StackOverflowError from a recursive tool must not end the run
            log.warn("Tool [{}] threw {}: {}", name, e.getClass().getSimpleName(), e.getMessage());
            throw new ToolExecutionException(name, e);
        }
    }

    public List<ToolSpec> getAllSpecs() {
        return List.copyOf(tools.values());
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }

    public static final class Builder {

        private final Map<String, ToolSpec> tools = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, ToolHandler handler, ArgumentSchema schema) {
            return register(new ToolSpec(name, "", schema, handler));
        }

        public Builder register(AgentTool tool) {
            return register(ToolSpec.from(tool));
        }

        public Builder register(ToolSpec spec) {
            if (tools.putIfAbsent(spec.name(), spec) != null) {
                throw new DuplicateToolException(spec.name());
            }
            log.info("Registered tool: [{}] {}", spec.name(), spec.description());
            return this;
        }

        public ToolRegistry build() {
            log.info("Total tools registered: {}", tools.size());
            return new ToolRegistry(tools);
        }
    }
}
