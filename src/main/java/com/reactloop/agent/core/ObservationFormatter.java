package com.reactloop.agent.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reactloop.agent.exception.ToolException;
import com.reactloop.agent.parser.ParsedReply;
import com.reactloop.agent.parser.ResponseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Text of the synthetic observation turns appended after each assistant reply.
 */
@Component
@Slf4j
public class ObservationFormatter {

    static final String PREFIX = "Observation: ";

    private final ObjectMapper objectMapper;

    public ObservationFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String result(Object result) {
        return PREFIX + render(result);
    }

    public String toolError(ToolException e) {
        return PREFIX + "ERROR: " + e.getMessage();
    }

    public String formatCorrection(ParsedReply.Malformed malformed) {
        return PREFIX + "ERROR: your reply could not be processed (" + malformed.reason() + "). "
                + "Reply with a Thought followed by either exactly one "
                + ResponseParser.ACTION_START + "{\"tool\": \"<name>\", \"args\": {...}}" + ResponseParser.ACTION_END
                + " block, or a line starting with '" + ResponseParser.FINAL_ANSWER_MARKER + "'.";
    }

    private String render(Object result) {
        if (result == null) {
            return "null";
        }
        if (result instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (result instanceof Map || result instanceof Collection || result.getClass().isArray()) {
            try {
                return objectMapper.writeValueAsString(result);
            } catch (JsonProcessingException e) {
                log.warn("Could not serialize tool result of type {}, falling back to toString: {}",
                        result.getClass().getSimpleName(), e.getOriginalMessage());
                return String.valueOf(result);
            }
        }
        return String.valueOf(result);
    }
}
