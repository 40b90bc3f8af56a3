package com.reactloop.agent.llm;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-call settings for {@link LlmClient#complete}.
 */
@Value
public class LlmOptions {

    /** Sampling randomness, 0 to 1 */
    double temperature;

    int maxOutputTokens;

    String modelId;

    /** Wall-clock limit for a single attempt */
    Duration timeout;

    /** Total attempt cap, first attempt included */
    int maxRetries;

    @Builder(toBuilder = true)
    public LlmOptions(double temperature, int maxOutputTokens, String modelId, Duration timeout, int maxRetries) {
        if (temperature < 0.0 || temperature > 1.0) {
            throw new IllegalArgumentException("temperature must be within [0, 1], got " + temperature);
        }
        if (maxOutputTokens <= 0) {
            throw new IllegalArgumentException("maxOutputTokens must be positive, got " + maxOutputTokens);
        }
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be blank");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
        }
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
        this.modelId = modelId;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
    }

    public static LlmOptions from(LlmProviderProperties props) {
        return LlmOptions.builder()
                .temperature(props.getTemperature())
                .maxOutputTokens(props.getMaxTokens())
                .modelId(props.getModel())
                .timeout(props.getTimeout())
                .maxRetries(props.getMaxRetries())
                .build();
    }
}
