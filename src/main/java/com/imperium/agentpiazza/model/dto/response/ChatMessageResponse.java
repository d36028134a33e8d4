package com.imperium.agentpiazza.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.imperium.agentpiazza.model.dto.chat.PendingPost;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 对话轮次响应。pending_post 非空时表示等待用户确认发布。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {

    private String reply;
    private String conversationId;
    private String sessionId;

    @Builder.Default
    private List<ChatMessageDto> messages = new ArrayList<>();

    @Builder.Default
    private List<AgentStepDto> steps = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private PendingPost pendingPost;
}
