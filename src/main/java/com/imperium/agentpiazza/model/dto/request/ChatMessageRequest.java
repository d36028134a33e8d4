package com.imperium.agentpiazza.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 对话消息请求，对应 POST /api/chat/{agentId}。
 */
@Data
public class ChatMessageRequest {

    /** 必填，1~4000 字符 */
    @NotBlank(message = "message is required")
    @Size(min = 1, max = 4000, message = "message length must be 1~4000")
    private String message;

    /** 可选，省略时开启新会话 */
    @Size(max = 64, message = "session_id length must be <= 64")
    private String sessionId;
}
