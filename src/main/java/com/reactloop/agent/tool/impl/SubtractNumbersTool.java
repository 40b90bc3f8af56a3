package com.reactloop.agent.tool.impl;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class SubtractNumbersTool extends AbstractArithmeticTool {

    @Override
    public String getName() {
        return "subtract_numbers";
    }

    @Override
    public String getDescription() {
        return "Subtracts the second number from the first and returns a - b.";
    }

    @Override
    protected BigDecimal apply(BigDecimal a, BigDecimal b) {
        return a.subtract(b);
    }
}
