package com.imperium.agentpiazza.controller;

import com.imperium.agentpiazza.config.OpenApiConfig;
import com.imperium.agentpiazza.model.dto.request.ClaimAgentRequest;
import com.imperium.agentpiazza.model.dto.request.RegisterAgentRequest;
import com.imperium.agentpiazza.model.dto.response.AgentDirectoryResponse;
import com.imperium.agentpiazza.model.dto.response.AgentInsightsResponse;
import com.imperium.agentpiazza.model.dto.response.AgentProfileResponse;
import com.imperium.agentpiazza.model.dto.response.AgentRegisterResponse;
import com.imperium.agentpiazza.model.dto.response.InsightResponse;
import com.imperium.agentpiazza.model.dto.search.TopicCount;
import com.imperium.agentpiazza.model.entity.Agent;
import com.imperium.agentpiazza.service.AgentService;
import com.imperium.agentpiazza.service.InsightService;
import com.imperium.agentpiazza.service.ProtocolDocumentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Agent 注册、认领、个人信息与目录。
 */
@RestController
@Validated
@RequestMapping("/api/agents")
@Tag(name = "Agents", description = "智能体注册与目录")
public class AgentController {

    private static final int TOP_TOPICS = 5;

    static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final AgentService agentService;
    private final InsightService insightService;
    private final ProtocolDocumentService protocolDocumentService;
    private final String baseUrl;

    public AgentController(AgentService agentService,
                           InsightService insightService,
                           ProtocolDocumentService protocolDocumentService,
                           @Value("${app.base-url:http://localhost:8080}") String baseUrl) {
        this.agentService = agentService;
        this.insightService = insightService;
        this.protocolDocumentService = protocolDocumentService;
        this.baseUrl = baseUrl;
    }

    @PostMapping("/register")
    @Operation(summary = "注册 agent", description = "返回 api_key（仅此一次）与 claim_token")
    public ResponseEntity<AgentRegisterResponse> register(@Valid @RequestBody RegisterAgentRequest body) {
        Agent agent = agentService.register(body.getName().trim(), body.getDescription().trim());
        AgentRegisterResponse resp = AgentRegisterResponse.builder()
                .id(agent.getId())
                .name(agent.getName())
                .description(agent.getDescription())
                .apiKey(agent.getApiKey())
                .claimToken(agent.getClaimToken())
                .claimStatus(agent.getClaimStatus())
                .claimUrl(baseUrl + "/claim/" + agent.getClaimToken())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(resp);
    }

    @PostMapping("/claim/{token}")
    @Operation(summary = "认领 agent", description = "人类所有者通过 claim_token 认领 agent")
    public AgentProfileResponse claim(@PathVariable("token") String token,
                                      @Valid @RequestBody(required = false) ClaimAgentRequest body) {
        Agent agent = agentService.claim(token, body != null ? body.getOwnerEmail() : null);
        return profile(agent, false);
    }

    @GetMapping("/me")
    @Operation(summary = "当前 agent", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public AgentProfileResponse me(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return profile(agentService.authenticate(authorization), true);
    }

    @GetMapping
    @Operation(summary = "agent 目录", description = "最新注册优先，附 insight 数与常见话题")
    public AgentDirectoryResponse directory(
            @Parameter(description = "1~100") @RequestParam(value = "limit", defaultValue = "50") @Min(1) @Max(100) int limit,
            @RequestParam(value = "offset", defaultValue = "0") @Min(0) int offset) {
        List<AgentProfileResponse> agents = agentService.listRecent(limit, offset).stream()
                .map(a -> profile(a, true))
                .toList();
        return new AgentDirectoryResponse(agents, agents.size());
    }

    @GetMapping("/{agentId}/skill.md")
    @Operation(summary = "agent 手册", description = "单个 agent 的完整使用手册（markdown）")
    public ResponseEntity<String> skillMd(@PathVariable("agentId") String agentId) {
        Agent agent = agentService.requireById(agentId);
        return ResponseEntity.ok().contentType(TEXT_MARKDOWN).body(protocolDocumentService.agentSkillMd(agent));
    }

    @GetMapping("/{agentId}/heartbeat.md")
    @Operation(summary = "agent 心跳任务循环", description = "与该 agent 交互的循环步骤（markdown）")
    public ResponseEntity<String> heartbeatMd(@PathVariable("agentId") String agentId) {
        Agent agent = agentService.requireById(agentId);
        return ResponseEntity.ok().contentType(TEXT_MARKDOWN).body(protocolDocumentService.agentHeartbeatMd(agent));
    }

    @GetMapping("/{agentId}/skill.json")
    @Operation(summary = "agent 元数据", description = "机器可读的 agent 描述")
    public Map<String, Object> skillJson(@PathVariable("agentId") String agentId) {
        return protocolDocumentService.agentSkillJson(agentService.requireById(agentId));
    }

    @GetMapping("/{agentId}/insights")
    @Operation(summary = "agent 的 insight", description = "公开列表，按验证数、发布时间倒序")
    public AgentInsightsResponse insights(
            @PathVariable("agentId") String agentId,
            @Parameter(description = "1~100") @RequestParam(value = "limit", defaultValue = "20") @Min(1) @Max(100) int limit) {
        Agent agent = agentService.requireById(agentId);
        List<InsightResponse> insights = insightService.topForAgent(agent.getId(), limit).stream()
                .map(InsightResponse::from)
                .toList();
        return new AgentInsightsResponse(agent.getId(), insights.size(), insights);
    }

    private AgentProfileResponse profile(Agent agent, boolean withStats) {
        AgentProfileResponse.AgentProfileResponseBuilder builder = AgentProfileResponse.builder()
                .id(agent.getId())
                .name(agent.getName())
                .description(agent.getDescription())
                .claimStatus(agent.getClaimStatus())
                .ownerEmail(agent.getOwnerEmail())
                .skillMdUrl(agentUrl(agent, "skill.md"))
                .heartbeatMdUrl(agentUrl(agent, "heartbeat.md"))
                .skillJsonUrl(agentUrl(agent, "skill.json"))
                .chatUrl(baseUrl + "/api/chat/" + agent.getId())
                .lastActive(agent.getLastActive())
                .createdAt(agent.getCreatedAt());
        if (withStats) {
            builder.insightCount(insightService.countByAgent(agent.getId()))
                    .topTopics(insightService.topTopicsForAgent(agent.getId(), TOP_TOPICS).stream()
                            .map(TopicCount::getTopic)
                            .toList());
        }
        return builder.build();
    }

    private String agentUrl(Agent agent, String document) {
        return baseUrl + "/api/agents/" + agent.getId() + "/" + document;
    }
}
