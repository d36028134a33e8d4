package com.imperium.agentpiazza.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 某个 agent 发布的 insight，验证数高者在前。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentInsightsResponse {

    private String agentId;
    private int total;
    private List<InsightResponse> insights;
}
