package com.reactloop.agent.api;

import com.reactloop.agent.core.AgentLoop;
import com.reactloop.agent.core.FailureReason;
import com.reactloop.agent.core.LoopResult;
import com.reactloop.agent.core.LoopStatus;
import com.reactloop.agent.exception.AgentException;
import com.reactloop.agent.exception.GlobalExceptionHandler;
import com.reactloop.agent.model.Message;
import com.reactloop.agent.tool.ToolRegistry;
import com.reactloop.agent.tool.impl.AddNumbersTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AgentControllerTest {

    @Mock
    private AgentLoop agentLoop;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ToolRegistry registry = ToolRegistry.builder().register(new AddNumbersTool()).build();
        mockMvc = MockMvcBuilders.standaloneSetup(new AgentController(agentLoop, registry))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void run_validTask_returnsLoopOutcome() throws Exception {
        when(agentLoop.run("Compute 123 + 456")).thenReturn(LoopResult.builder()
                .status(LoopStatus.SUCCESS)
                .answer("579")
                .stepsUsed(2)
                .transcript(List.of(Message.system("sys"), Message.user("Compute 123 + 456")))
                .build());

        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task\": \"Compute 123 + 456\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.finalAnswer").value("579"))
                .andExpect(jsonPath("$.stepsUsed").value(2))
                .andExpect(jsonPath("$.transcript[1].role").value("user"));
    }

    @Test
    void run_fatalError_stillReturns200WithReason() throws Exception {
        when(agentLoop.run(anyString())).thenReturn(LoopResult.builder()
                .status(LoopStatus.FATAL_ERROR)
                .failureReason(FailureReason.AUTH)
                .errorMessage("deepseek rejected the API key [401]")
                .transcript(List.of(Message.system("sys"), Message.user("hi")))
                .build());

        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task\": \"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FATAL_ERROR"))
                .andExpect(jsonPath("$.failureReason").value("AUTH"));
    }

    @Test
    void run_blankTask_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task\": \"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("task: task must not be blank"));

        verifyNoInteractions(agentLoop);
    }

    @Test
    void run_unreadableBody_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void run_setupFailure_returns500WithReason() throws Exception {
        when(agentLoop.run(anyString()))
                .thenThrow(new AgentException("Could not render tool 'broken' for the system prompt"));

        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task\": \"hi\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error")
                        .value("Agent run could not start: Could not render tool 'broken' for the system prompt"));
    }

    @Test
    void run_plainTextBody_returns415() throws Exception {
        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("Compute 1 + 1"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error").value("Content-Type must be application/json"));

        verifyNoInteractions(agentLoop);
    }

    @Test
    void tools_listsRegisteredTools() throws Exception {
        mockMvc.perform(get("/api/v1/agent/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("add_numbers"))
                .andExpect(jsonPath("$[0].args.a").value("number"));
    }

    @Test
    void health_returnsUp() throws Exception {
        mockMvc.perform(get("/api/v1/agent/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
