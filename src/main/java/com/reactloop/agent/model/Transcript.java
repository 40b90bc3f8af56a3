package com.reactloop.agent.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only conversation history for one agent run.
 *
 * Always starts with the system prompt followed by the user task. Owned by a single run,
 * so it is not thread-safe.
 */
public final class Transcript {

    private final List<Message> messages = new ArrayList<>();

    private Transcript() {
    }

    public static Transcript start(String systemPrompt, String task) {
        Transcript transcript = new Transcript();
        transcript.messages.add(Message.system(systemPrompt));
        transcript.messages.add(Message.user(task));
        return transcript;
    }

    public void append(Message message) {
        if (message.getRole() == Message.Role.system) {
            throw new IllegalArgumentException("Only the first message of a transcript may be a system message");
        }
        messages.add(message);
    }

    /** Read-only live view */
    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    /** Detached copy, safe to hand out after the run ends */
    public List<Message> snapshot() {
        return List.copyOf(messages);
    }

    public Message last() {
        return messages.get(messages.size() - 1);
    }

    public int size() {
        return messages.size();
    }
}
