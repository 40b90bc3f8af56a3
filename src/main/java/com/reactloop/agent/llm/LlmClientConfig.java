package com.reactloop.agent.llm;

import com.reactloop.agent.resilience.BackoffPolicy;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.net.URI;

/**
 * Wires the provider client, the retry policy and the default per-call options.
 * The raw client is exposed under "providerLlmClient"; the agent loop receives the
 * retrying {@code ResilientLlmClient}, which is the primary LlmClient bean.
 */
@Configuration
@EnableConfigurationProperties(LlmProviderProperties.class)
@Slf4j
public class LlmClientConfig {

    private final LlmProviderProperties props;

    public LlmClientConfig(LlmProviderProperties props) {
        this.props = props;
    }

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  LLM endpoint : {}", props.getBaseUrl());
        log.info("  Model        : {}", props.getModel());
        log.info("  Timeout      : {}  Max attempts: {}", props.getTimeout(), props.getMaxRetries());
        logKey(props.getApiKey());
        log.info("================================================================");
    }

    @Bean("providerLlmClient")
    public LlmClient providerLlmClient(RestClient.Builder restClientBuilder) {
        return new GenericLlmClient(props, providerName(props.getBaseUrl()), restClientBuilder);
    }

    @Bean
    public BackoffPolicy llmBackoffPolicy() {
        return new BackoffPolicy(props.getBackoffBase(), props.getBackoffMax(), props.getBackoffJitter(),
                props.getRetryAfterMax());
    }

    @Bean
    public LlmOptions defaultLlmOptions() {
        return LlmOptions.from(props);
    }

    /** "api.deepseek.com" becomes "deepseek"; used only to label log lines and errors */
    static String providerName(String baseUrl) {
        try {
            String host = URI.create(baseUrl).getHost();
            if (host == null) {
                return "llm";
            }
            String[] parts = host.split("\\.");
            return parts.length >= 2 ? parts[parts.length - 2] : host;
        } catch (IllegalArgumentException e) {
            return "llm";
        }
    }

    private void logKey(String key) {
        if (key == null || key.isBlank()) {
            log.error("  API key not set! Set env var: LLM_API_KEY={your-key}");
        } else {
            log.info("  Key          : {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
