package com.imperium.agentpiazza.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Agent 公开资料，用于 /me、认领结果与目录列表。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentProfileResponse {

    private String id;
    private String name;
    private String description;
    private String claimStatus;
    private String ownerEmail;
    private Long insightCount;
    private List<String> topTopics;
    private String skillMdUrl;
    private String heartbeatMdUrl;
    private String skillJsonUrl;
    private String chatUrl;
    private LocalDateTime lastActive;
    private LocalDateTime createdAt;
}
