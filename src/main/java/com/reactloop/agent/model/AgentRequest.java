package com.reactloop.agent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AgentRequest {

    @NotBlank(message = "task must not be blank")
    private String task;
}
