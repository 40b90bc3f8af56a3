package com.reactloop.agent.tool.impl;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class MultiplyNumbersTool extends AbstractArithmeticTool {

    @Override
    public String getName() {
        return "multiply_numbers";
    }

    @Override
    public String getDescription() {
        return "Multiplies two numbers and returns a * b.";
    }

    @Override
    protected BigDecimal apply(BigDecimal a, BigDecimal b) {
        return a.multiply(b);
    }
}
