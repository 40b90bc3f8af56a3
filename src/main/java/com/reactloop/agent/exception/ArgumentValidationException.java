package com.reactloop.agent.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Arguments did not match the tool's schema. Raised before the handler runs.
 */
public class ArgumentValidationException extends ToolException {

    private final Map<String, String> violations;

    /**
     * @param violations offending argument name mapped to what is wrong with it, in schema order
     */
    public ArgumentValidationException(String toolName, Map<String, String> violations) {
        super(toolName, String.format("Invalid arguments for tool '%s': %s", toolName,
                violations.entrySet().stream()
                        .map(e -> e.getKey() + " (" + e.getValue() + ")")
                        .collect(Collectors.joining(", "))));
        this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    public List<String> getOffendingKeys() {
        return List.copyOf(violations.keySet());
    }

    public Map<String, String> getViolations() {
        return violations;
    }
}
