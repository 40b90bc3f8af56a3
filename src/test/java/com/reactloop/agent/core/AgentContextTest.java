package com.reactloop.agent.core;

import com.reactloop.agent.model.Message;
import com.reactloop.agent.model.Transcript;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentContextTest {

    private AgentContext newContext() {
        return AgentContext.builder()
                .runId("abc12345")
                .task("t")
                .transcript(Transcript.start("sys", "t"))
                .executedToolCalls(new ArrayList<>())
                .build();
    }

    @Test
    void newContext_startsRunning() {
        assertThat(newContext().getState()).isEqualTo(AgentState.RUNNING);
    }

    @Test
    void transitionTo_terminalState_isFinal() {
        AgentContext context = newContext();
        context.transitionTo(AgentState.SUCCEEDED);

        assertThatThrownBy(() -> context.transitionTo(AgentState.RUNNING))
                .isInstanceOf(IllegalStateException.class);
        assertThat(context.getState()).isEqualTo(AgentState.SUCCEEDED);
    }

    @Test
    void transcript_rejectsSecondSystemMessage() {
        Transcript transcript = Transcript.start("sys", "task");

        assertThatThrownBy(() -> transcript.append(Message.system("again")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(transcript.size()).isEqualTo(2);
    }

    @Test
    void transcript_snapshotIsDetached() {
        Transcript transcript = Transcript.start("sys", "task");
        var snapshot = transcript.snapshot();

        transcript.append(Message.assistant("Final Answer: x"));

        assertThat(snapshot).hasSize(2);
        assertThat(transcript.last().getContent()).isEqualTo("Final Answer: x");
    }
}
