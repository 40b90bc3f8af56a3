package com.reactloop.agent.llm;

import com.reactloop.agent.exception.AuthException;
import com.reactloop.agent.exception.BadRequestException;
import com.reactloop.agent.exception.LlmException;
import com.reactloop.agent.exception.RateLimitException;
import com.reactloop.agent.exception.TransportException;
import com.reactloop.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-attempt client for OpenAI-compatible chat-completion APIs (DeepSeek, OpenAI, Groq).
 * Retries live in {@code ResilientLlmClient}; this class only classifies what went wrong.
 *
 * Error classification:
 *
 * | Error                     | Exception             | Retried by the decorator      |
 * |---------------------------|-----------------------|-------------------------------|
 * | 401 / 403                 | AuthException         | no                            |
 * | 429 with Retry-After      | RateLimitException    | yes, after the hinted delay   |
 * | 429 without Retry-After   | RateLimitException    | no                            |
 * | other 4xx                 | BadRequestException   | no                            |
 * | 5xx                       | TransportException    | yes                           |
 * | connect / read timeout    | TransportException    | yes                           |
 * | 2xx without content       | LlmException          | no                            |
 */
@Slf4j
public class GenericLlmClient implements LlmClient, DisposableBean {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient.Builder restClientBuilder;

    // One RestClient per distinct per-attempt timeout; in practice there is a single entry.
    private final ConcurrentMap<Duration, RestClient> restClients = new ConcurrentHashMap<>();
    private final ConcurrentMap<Duration, CloseableHttpClient> httpClients = new ConcurrentHashMap<>();

    public GenericLlmClient(LlmProviderProperties props,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        this.restClientBuilder = restClientBuilder;
    }

    @Override
    public String complete(List<Message> transcript, LlmOptions options) {
        Map<String, Object> requestBody = buildRequestBody(transcript, options);

        log.debug("Sending {} messages to {} [model={}]",
                transcript.size(), providerName, options.getModelId());

        Map<String, Object> response;
        try {
            response = restClientFor(options.getTimeout()).post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> handle4xxError(res))
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = readBody(res);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new TransportException(
                                providerName + " server error [" + res.getStatusCode().value() + "]: " + body,
                                res.getStatusCode().value());
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            // Connection refused, DNS failure, connect or read timeout
            throw new TransportException(providerName + " unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new LlmException(providerName + " returned an unreadable response: " + e.getMessage(), e);
        }

        return extractContent(response);
    }

    /**
     * Central 4xx handler. Maps status codes to the exception types the retry decorator keys on.
     */
    private void handle4xxError(ClientHttpResponse res) throws IOException {
        int statusCode = res.getStatusCode().value();
        String body = readBody(res);
        log.error("{} 4xx [{}]: {}", providerName, statusCode, body);

        if (statusCode == 401 || statusCode == 403) {
            throw new AuthException(providerName + " rejected the API key [" + statusCode + "]. "
                    + "Check the LLM_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            Duration retryAfter = parseRetryAfter(res.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
            throw new RateLimitException(providerName + " rate limit exceeded"
                    + (retryAfter != null ? " (retry after " + retryAfter.toMillis() + "ms)" : ""), retryAfter);
        }

        throw new BadRequestException(providerName + " client error [" + statusCode + "]: " + body, statusCode);
    }

    private Map<String, Object> buildRequestBody(List<Message> transcript, LlmOptions options) {
        List<Map<String, Object>> formattedMessages = transcript.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", options.getModelId());
        body.put("max_tokens", options.getMaxOutputTokens());
        body.put("temperature", options.getTemperature());
        body.put("messages", formattedMessages);
        body.put("stream", false);
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        // Observations are plain text for the model to read, not native tool results:
        // there is no tool_call_id to correlate them with, so they go out as user turns.
        Message.Role role = msg.getRole() == Message.Role.tool ? Message.Role.user : msg.getRole();
        m.put("role", role.name());
        m.put("content", msg.getContent() != null ? msg.getContent() : "");
        return m;
    }

    @SuppressWarnings("unchecked")
    private String extractContent(Map<String, Object> response) {
        if (response == null) {
            throw new LlmException(providerName + " returned an empty body");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage [prompt={}, completion={}]",
                    usage.get("prompt_tokens"), usage.get("completion_tokens"));
        }

        Object choicesValue = response.get("choices");
        if (!(choicesValue instanceof List<?> choices) || choices.isEmpty()
                || !(choices.get(0) instanceof Map<?, ?> choice)) {
            throw new LlmException(providerName + " returned no choices in response");
        }
        if (!(choice.get("message") instanceof Map<?, ?> message)
                || !(message.get("content") instanceof String content)) {
            throw new LlmException(providerName + " returned a choice without message content");
        }

        log.debug("{} finish_reason: {}", providerName, choice.get("finish_reason"));
        return content;
    }

    private RestClient restClientFor(Duration timeout) {
        return restClients.computeIfAbsent(timeout, t -> restClientBuilder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, "application/json")
                .requestFactory(requestFactory(t))
                .build());
    }

    private HttpComponentsClientHttpRequestFactory requestFactory(Duration timeout) {
        CloseableHttpClient httpClient = HttpClients.custom()
                // ResilientLlmClient is the only retry layer; the built-in strategy would replay 429/503
                .disableAutomaticRetries()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.of(timeout))
                                .setSocketTimeout(Timeout.of(timeout))
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(timeout))
                        .build())
                .build();
        httpClients.put(timeout, httpClient);
        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }

    @Override
    public void destroy() {
        restClients.clear();
        httpClients.forEach((timeout, httpClient) -> {
            try {
                httpClient.close();
            } catch (IOException e) {
                log.warn("Failed to close HTTP client [timeout={}]: {}", timeout, e.getMessage());
            }
        });
        httpClients.clear();
    }

    /** Number of pooled HTTP clients currently open */
    int openHttpClients() {
        return httpClients.size();
    }

    private static String readBody(ClientHttpResponse res) throws IOException {
        return new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Retry-After is either delta-seconds ("120") or an HTTP-date. Returns null when absent or unparseable.
     */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            long seconds = Long.parseLong(value);
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration until = Duration.between(ZonedDateTime.now(at.getZone()), at);
                return until.isNegative() ? Duration.ZERO : until;
            } catch (DateTimeParseException notDate) {
                log.warn("Ignoring unparseable Retry-After header: '{}'", value);
                return null;
            }
        }
    }
}
