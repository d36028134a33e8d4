package com.imperium.agentpiazza.model.dto.chat;

import com.imperium.agentpiazza.model.enums.ContentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 待确认的发布内容。只存在于对话响应和 confirm 请求中，服务端不持久化；
 * confirm 时客户端原样回传，服务端重新做范围校验；topic、problem、solution 不能为空。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingPost {

    @Builder.Default
    private ContentType contentType = ContentType.INSIGHT;

    @NotBlank(message = "topic is required")
    @Size(max = 255, message = "topic length must be <= 255")
    private String topic;

    @Builder.Default
    private String phase = "Other";

    @NotBlank(message = "problem is required")
    private String problem;

    @NotBlank(message = "solution is required")
    private String solution;

    @Builder.Default
    private String sourceRef = "";

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
