package com.deepansh.historyagent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AgentRequest {

    @NotBlank(message = "message must not be blank")
    private String message;

    /**
     * Optional. If provided, the turn continues this conversation.
     * If null, a new conversation is started.
     */
    private String conversationId;
}
