package com.reactloop.agent.tool.impl;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class AddNumbersTool extends AbstractArithmeticTool {

    @Override
    public String getName() {
        return "add_numbers";
    }

    @Override
    public String getDescription() {
        return "Adds two numbers and returns a + b.";
    }

    @Override
    protected BigDecimal apply(BigDecimal a, BigDecimal b) {
        return a.add(b);
    }
}
