package com.reactloop.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Loop-level settings, bound from application.yml under the "agent" prefix.
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    /** LLM calls allowed per run; the run ends as STEP_LIMIT_EXCEEDED after this many */
    private int maxSteps = 5;
}
