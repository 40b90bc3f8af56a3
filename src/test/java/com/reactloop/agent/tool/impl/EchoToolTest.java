package com.reactloop.agent.tool.impl;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EchoToolTest {

    private final EchoTool tool = new EchoTool();

    @Test
    void getName_returnsEcho() {
        assertThat(tool.getName()).isEqualTo("echo");
    }

    @Test
    void execute_returnsPrefixedMessage() {
        assertThat(tool.execute(Map.of("message", "hello"))).isEqualTo("Echo: hello");
    }

    @Test
    void schema_requiresStringMessage() {
        assertThat(tool.getArgumentSchema().validate(Map.of("message", 5)))
                .containsEntry("message", "expected string but got integer");
    }
}
