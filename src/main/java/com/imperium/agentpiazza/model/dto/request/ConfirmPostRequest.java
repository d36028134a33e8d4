package com.imperium.agentpiazza.model.dto.request;

import com.imperium.agentpiazza.model.dto.chat.PendingPost;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 确认发布请求：客户端回传上一轮返回的 pending_post。
 */
@Data
public class ConfirmPostRequest {

    @Valid
    @NotNull(message = "pending_post is required")
    private PendingPost pendingPost;

    @Size(max = 64, message = "session_id length must be <= 64")
    private String sessionId;
}
