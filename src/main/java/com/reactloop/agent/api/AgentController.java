package com.reactloop.agent.api;

import com.reactloop.agent.core.AgentLoop;
import com.reactloop.agent.core.LoopResult;
import com.reactloop.agent.model.AgentRequest;
import com.reactloop.agent.model.AgentResponse;
import com.reactloop.agent.tool.ToolRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent endpoints.
 *
 * POST /api/v1/agent/run    run one task to completion
 * GET  /api/v1/agent/tools  tool catalogue as shown to the model
 * GET  /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentLoop agentLoop;
    private final ToolRegistry toolRegistry;

    /**
     * Runs one task to completion. Every outcome, including step-limit and LLM failures,
     * is a 200 carrying the status and the transcript; only malformed requests are 4xx.
     */
    @PostMapping("/run")
    public ResponseEntity<AgentResponse> run(@Valid @RequestBody AgentRequest request) {
        log.info("Agent run request [taskLength={}]", request.getTask().length());
        LoopResult result = agentLoop.run(request.getTask());
        return ResponseEntity.ok(AgentResponse.from(result));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<Map<String, Object>>> tools() {
        List<Map<String, Object>> tools = toolRegistry.getAllSpecs().stream()
                .map(spec -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", spec.name());
                    entry.put("description", spec.description());
                    entry.put("args", spec.schema().toPromptSignature());
                    return entry;
                })
                .toList();
        return ResponseEntity.ok(tools);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
