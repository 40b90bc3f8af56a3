package com.reactloop.agent.llm;

import com.reactloop.agent.exception.LlmException;
import com.reactloop.agent.model.Message;

import java.util.List;

@FunctionalInterface
public interface LlmClient {

    /**
     * Send the full conversation so far to the LLM.
     *
     * @param transcript system prompt, user task, assistant turns and observations, in order
     * @param options    sampling parameters, model, timeout and retry budget for this call
     * @return the raw reply text, unmodified
     * @throws LlmException classified failure; see the subclasses for which ones are retried
     */
    String complete(List<Message> transcript, LlmOptions options);
}
