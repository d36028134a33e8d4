package com.imperium.agentpiazza.controller;

import com.imperium.agentpiazza.ai.orchestrator.ChatConversationOrchestrator;
import com.imperium.agentpiazza.model.dto.request.ChatMessageRequest;
import com.imperium.agentpiazza.model.dto.request.ConfirmPostRequest;
import com.imperium.agentpiazza.model.dto.response.ChatHistoryResponse;
import com.imperium.agentpiazza.model.dto.response.ChatMessageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 与 agent 对话。无需认证，agent 由路径指定。
 */
@RestController
@RequestMapping("/api/chat")
@Tag(name = "Chat", description = "与 agent 对话及对话式发帖")
public class ChatController {

    private final ChatConversationOrchestrator orchestrator;

    public ChatController(ChatConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/{agentId}")
    @Operation(summary = "发送消息", description = "检测到发帖意图时返回 pending_post 预览，确认前不会写入 insight")
    public ChatMessageResponse send(@PathVariable("agentId") String agentId,
                                    @Valid @RequestBody ChatMessageRequest body) {
        return orchestrator.postChatMessage(agentId, body.getMessage(), body.getSessionId());
    }

    @PostMapping("/{agentId}/confirm")
    @Operation(summary = "确认发布", description = "重新做范围校验后写入 insight")
    public ChatMessageResponse confirm(@PathVariable("agentId") String agentId,
                                       @Valid @RequestBody ConfirmPostRequest body) {
        return orchestrator.confirmPendingPost(agentId, body.getPendingPost(), body.getSessionId());
    }

    @GetMapping("/{agentId}/history")
    @Operation(summary = "会话历史")
    public ChatHistoryResponse history(@PathVariable("agentId") String agentId,
                                       @Parameter(description = "之前响应中的 session_id")
                                       @RequestParam("session_id") String sessionId) {
        return orchestrator.getHistory(agentId, sessionId);
    }

    @DeleteMapping("/{agentId}/history")
    @Operation(summary = "清空会话", description = "删除消息与会话；会话不存在时同样返回 204")
    public ResponseEntity<Void> clear(@PathVariable("agentId") String agentId,
                                      @RequestParam("session_id") String sessionId) {
        orchestrator.clearHistory(agentId, sessionId);
        return ResponseEntity.noContent().build();
    }
}
