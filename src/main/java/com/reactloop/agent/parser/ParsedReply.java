package com.reactloop.agent.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classification of one raw model reply.
 */
public sealed interface ParsedReply permits ParsedReply.Action, ParsedReply.FinalAnswer, ParsedReply.Malformed {

    /** The model asked for a tool call */
    record Action(String reasoning, String toolName, Map<String, Object> arguments) implements ParsedReply {
        public Action {
            arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }
    }

    /** The model declared the task finished */
    record FinalAnswer(String reasoning, String answer) implements ParsedReply {}

    /** Neither directive could be extracted; {@code reason} is always non-empty */
    record Malformed(String rawText, String reason) implements ParsedReply {}
}
