package com.reactloop.agent.parser;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns the model's free-text reply into a {@link ParsedReply}.
 *
 * Reply protocol:
 * <pre>
 * Thought: I need to add the two numbers.
 * [ACTION_START]
 * {"tool": "add_numbers", "args": {"a": 123, "b": 456}}
 * [ACTION_END]
 * </pre>
 * or
 * <pre>
 * Thought: I have the result.
 * Final Answer: 579
 * </pre>
 *
 * A Final Answer marker wins over a co-present action block: termination beats further tool use.
 * The action payload is never repaired or coerced. Anything off-protocol comes back as
 * {@link ParsedReply.Malformed} with a reason the loop can feed to the model.
 * {@link #parse(String)} never throws.
 */
@Component
@Slf4j
public class ResponseParser {

    public static final String FINAL_ANSWER_MARKER = "Final Answer:";
    public static final String ACTION_START = "[ACTION_START]";
    public static final String ACTION_END = "[ACTION_END]";

    static final String NO_DIRECTIVE = "no recognized directive";

    private static final Set<String> PAYLOAD_KEYS = Set.of("tool", "args");

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    public ParsedReply parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return new ParsedReply.Malformed(rawText == null ? "" : rawText, "empty reply");
        }

        int finalIdx = rawText.indexOf(FINAL_ANSWER_MARKER);
        if (finalIdx >= 0) {
            return new ParsedReply.FinalAnswer(
                    rawText.substring(0, finalIdx).strip(),
                    rawText.substring(finalIdx + FINAL_ANSWER_MARKER.length()).strip());
        }

        int start = rawText.indexOf(ACTION_START);
        if (start < 0) {
            return rawText.contains(ACTION_END)
                    ? malformed(rawText, ACTION_END + " found without a preceding " + ACTION_START)
                    : malformed(rawText, NO_DIRECTIVE);
        }

        int payloadStart = start + ACTION_START.length();
        int end = rawText.indexOf(ACTION_END, payloadStart);
        if (end < 0) {
            return malformed(rawText, "action block is missing the closing " + ACTION_END + " marker");
        }
        if (rawText.indexOf(ACTION_START, payloadStart) >= 0) {
            return malformed(rawText, "more than one action block; send exactly one action per reply");
        }

        String reasoning = rawText.substring(0, start).strip();
        return parseActionPayload(rawText, reasoning, rawText.substring(payloadStart, end).strip());
    }

    private ParsedReply parseActionPayload(String rawText, String reasoning, String payload) {
        if (payload.isEmpty()) {
            return malformed(rawText, "action block is empty");
        }

        JsonNode root;
        try {
            root = strictReader.readTree(payload);
        } catch (JsonProcessingException e) {
            return malformed(rawText, "action block is not valid JSON: " + e.getOriginalMessage());
        }

        if (root == null || !root.isObject()) {
            return malformed(rawText, "action block must contain a single JSON object");
        }

        Set<String> keys = new TreeSet<>();
        root.fieldNames().forEachRemaining(keys::add);

        List<String> problems = new ArrayList<>();
        Set<String> missing = new TreeSet<>(PAYLOAD_KEYS);
        missing.removeAll(keys);
        if (!missing.isEmpty()) {
            problems.add("missing key(s) " + missing);
        }
        Set<String> extra = new TreeSet<>(keys);
        extra.removeAll(PAYLOAD_KEYS);
        if (!extra.isEmpty()) {
            problems.add("unexpected key(s) " + extra);
        }
        if (!problems.isEmpty()) {
            return malformed(rawText, "action payload must have exactly the keys \"tool\" and \"args\": "
                    + String.join("; ", problems));
        }

        JsonNode tool = root.get("tool");
        if (!tool.isTextual() || tool.asText().isBlank()) {
            return malformed(rawText, "\"tool\" must be a non-empty string");
        }
        JsonNode args = root.get("args");
        if (!args.isObject()) {
            return malformed(rawText, "\"args\" must be a JSON object");
        }

        Map<String, Object> arguments = objectMapper.convertValue(args, new TypeReference<>() {});
        return new ParsedReply.Action(reasoning, tool.asText(), arguments);
    }

    private ParsedReply malformed(String rawText, String reason) {
        log.debug("Malformed reply: {}", reason);
        return new ParsedReply.Malformed(rawText, reason);
    }
}
