package com.reactloop.agent.config;

import com.reactloop.agent.tool.AgentTool;
import com.reactloop.agent.tool.ToolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the tool registry from every {@link AgentTool} bean Spring discovers.
 * Two beans with the same tool name fail start-up with a DuplicateToolException.
 */
@Configuration
public class ToolConfig {

    @Bean
    public ToolRegistry toolRegistry(List<AgentTool> tools) {
        ToolRegistry.Builder builder = ToolRegistry.builder();
        tools.forEach(builder::register);
        return builder.build();
    }
}
