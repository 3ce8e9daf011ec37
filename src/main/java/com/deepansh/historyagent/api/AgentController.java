package com.deepansh.historyagent.api;

import com.deepansh.historyagent.conversation.ConversationService;
import com.deepansh.historyagent.core.Orchestrator;
import com.deepansh.historyagent.model.AgentRequest;
import com.deepansh.historyagent.model.AgentResponse;
import com.deepansh.historyagent.model.AgentState;
import com.deepansh.historyagent.tool.ToolRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * POST /api/v1/agent/chat
 *   Body: {"message": "...", "conversationId": "optional"}
 *
 * POST /api/v1/agent/conversations/{id}/cancel
 *   Signals the running turn of a conversation; 404 when nothing is running.
 *
 * GET /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final ConversationService conversationService;
    private final ToolRegistry toolRegistry;

    @PostMapping("/chat")
    public ResponseEntity<AgentResponse> chat(@Valid @RequestBody AgentRequest request) {
        log.info("Chat request [conversationId={}]", request.getConversationId());
        AgentState state = conversationService.chat(request.getConversationId(), request.getMessage());
        return ResponseEntity.ok(AgentResponse.from(state, Orchestrator.GENERIC_FAILURE_MESSAGE));
    }

    @PostMapping("/conversations/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable("id") String conversationId) {
        if (!conversationService.cancel(conversationId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().body(Map.of("conversationId", conversationId, "cancelled", true));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "UP", "tools", toolRegistry.toolCount()));
    }
}
