package com.reactloop.agent.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection and sampling settings for the OpenAI-compatible provider.
 * Bound from application.yml under the "llm" prefix.
 */
@Data
@ConfigurationProperties(prefix = "llm")
public class LlmProviderProperties {

    private String apiKey = "";
    private String baseUrl = "https://api.deepseek.com/v1";
    private String model = "deepseek-chat";
    private int maxTokens = 2000;
    private double temperature = 0.1;

    /** Per-attempt limit, applied as both connect and response timeout */
    private Duration timeout = Duration.ofSeconds(30);

    /** Total attempts per completion, first attempt included */
    private int maxRetries = 3;

    private Duration backoffBase = Duration.ofSeconds(1);
    private Duration backoffMax = Duration.ofSeconds(8);

    /** Extra random delay as a fraction of the exponential delay, 0 disables jitter */
    private double backoffJitter = 0.2;

    /** Longest Retry-After hint worth waiting for; a 429 asking for more fails at once */
    private Duration retryAfterMax = Duration.ofSeconds(60);
}
