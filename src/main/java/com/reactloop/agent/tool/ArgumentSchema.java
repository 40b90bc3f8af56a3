package com.reactloop.agent.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of the named arguments a tool accepts.
 *
 * Validation is strict: a required key must be present, every present key must be
 * declared, and every value must match its declared type. JSON null only satisfies {@code any}.
 */
public final class ArgumentSchema {

    private final Map<String, Parameter> parameters;

    private ArgumentSchema(Map<String, Parameter> parameters) {
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ArgumentSchema empty() {
        return new ArgumentSchema(Map.of());
    }

    public List<Parameter> getParameters() {
        return List.copyOf(parameters.values());
    }

    /**
     * Checks the arguments against this schema.
     *
     * @return offending key mapped to a short description of the defect; empty when valid
     */
    public Map<String, String> validate(Map<String, Object> arguments) {
        Map<String, String> violations = new LinkedHashMap<>();

        for (Parameter p : parameters.values()) {
            if (!arguments.containsKey(p.name())) {
                if (p.required()) {
                    violations.put(p.name(), "missing required argument");
                }
                continue;
            }
            Object value = arguments.get(p.name());
            if (!p.type().accepts(value)) {
                violations.put(p.name(), "expected " + p.type().jsonName()
                        + " but got " + ArgumentType.describe(value));
            }
        }

        arguments.keySet().stream()
                .filter(key -> !parameters.containsKey(key))
                .sorted()
                .forEach(key -> violations.put(key, "unexpected argument"));

        return violations;
    }

    /**
     * Compact {@code {"name": "type"}} view used when listing tools in the system prompt.
     * Optional parameters are suffixed with {@code ?}.
     */
    public Map<String, String> toPromptSignature() {
        Map<String, String> signature = new LinkedHashMap<>();
        parameters.values().forEach(p ->
                signature.put(p.name(), p.type().jsonName() + (p.required() ? "" : "?")));
        return signature;
    }

    public record Parameter(String name, ArgumentType type, boolean required, String description) {}

    public static final class Builder {

        private final List<Parameter> parameters = new ArrayList<>();

        private Builder() {
        }

        public Builder required(String name, ArgumentType type, String description) {
            parameters.add(new Parameter(name, type, true, description));
            return this;
        }

        public Builder optional(String name, ArgumentType type, String description) {
            parameters.add(new Parameter(name, type, false, description));
            return this;
        }

        public ArgumentSchema build() {
            Map<String, Parameter> byName = new LinkedHashMap<>();
            for (Parameter p : parameters) {
                if (p.name() == null || p.name().isBlank()) {
                    throw new IllegalArgumentException("Parameter name must not be blank");
                }
                if (byName.putIfAbsent(p.name(), p) != null) {
                    throw new IllegalArgumentException("Parameter '" + p.name() + "' declared twice");
                }
            }
            return new ArgumentSchema(byName);
        }
    }
}
