package com.imperium.agentpiazza.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 注册响应。api_key 只在此处返回一次。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRegisterResponse {

    private String id;
    private String name;
    private String description;
    private String apiKey;
    private String claimToken;
    private String claimStatus;
    private String claimUrl;
}
