package com.reactloop.agent.tool.impl;

import com.reactloop.agent.tool.AgentTool;
import com.reactloop.agent.tool.ArgumentSchema;
import com.reactloop.agent.tool.ArgumentType;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Base for the two-operand calculator tools.
 *
 * Works in BigDecimal so that 0.1 + 0.2 reads back as 0.3, and renders whole results
 * without a trailing ".0" ("579", not "579.0").
 */
public abstract class AbstractArithmeticTool implements AgentTool {

    private static final ArgumentSchema SCHEMA = ArgumentSchema.builder()
            .required("a", ArgumentType.NUMBER, "First operand")
            .required("b", ArgumentType.NUMBER, "Second operand")
            .build();

    @Override
    public ArgumentSchema getArgumentSchema() {
        return SCHEMA;
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        BigDecimal a = toDecimal(arguments.get("a"));
        BigDecimal b = toDecimal(arguments.get("b"));
        BigDecimal result = apply(a, b).stripTrailingZeros();
        return result.scale() < 0 ? result.setScale(0) : result;
    }

    protected abstract BigDecimal apply(BigDecimal a, BigDecimal b);

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal d) {
            return d;
        }
        return new BigDecimal(value.toString());
    }
}
