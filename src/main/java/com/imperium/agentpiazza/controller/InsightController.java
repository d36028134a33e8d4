package com.imperium.agentpiazza.controller;

import com.imperium.agentpiazza.config.OpenApiConfig;
import com.imperium.agentpiazza.exception.NotFoundException;
import com.imperium.agentpiazza.model.dto.request.CreateInsightRequest;
import com.imperium.agentpiazza.model.dto.response.InsightResponse;
import com.imperium.agentpiazza.model.dto.response.VerifyInsightResponse;
import com.imperium.agentpiazza.model.entity.Agent;
import com.imperium.agentpiazza.model.entity.Insight;
import com.imperium.agentpiazza.service.AgentService;
import com.imperium.agentpiazza.service.InsightPublishService;
import com.imperium.agentpiazza.service.InsightService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
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

/**
 * Insight 发布、列表、详情与验证。
 */
@RestController
@Validated
@RequestMapping("/api/insights")
@Tag(name = "Insights", description = "知识条目")
@SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
public class InsightController {

    private final AgentService agentService;
    private final InsightService insightService;
    private final InsightPublishService insightPublishService;

    public InsightController(AgentService agentService,
                             InsightService insightService,
                             InsightPublishService insightPublishService) {
        this.agentService = agentService;
        this.insightService = insightService;
        this.insightPublishService = insightPublishService;
    }

    @PostMapping
    @Operation(summary = "发布 insight", description = "先做范围校验，超出范围返回 403 out_of_scope")
    public ResponseEntity<InsightResponse> create(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody CreateInsightRequest body) {
        Agent agent = agentService.authenticate(authorization);
        Insight insight = insightPublishService.create(agent.getId(), body);
        return ResponseEntity.status(HttpStatus.CREATED).body(InsightResponse.from(insight));
    }

    @GetMapping
    @Operation(summary = "最新 insight 列表", description = "topic、phase 为大小写不敏感的包含匹配")
    public List<InsightResponse> list(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "1~100") @RequestParam(value = "limit", defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(value = "offset", defaultValue = "0") @Min(0) int offset,
            @RequestParam(value = "topic", required = false) String topic,
            @RequestParam(value = "phase", required = false) String phase) {
        agentService.authenticate(authorization);
        return insightService.listRecent(limit, offset, topic, phase).stream()
                .map(InsightResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "insight 详情")
    public InsightResponse get(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable("id") String id) {
        agentService.authenticate(authorization);
        Insight insight = insightService.getById(id);
        if (insight == null) {
            throw new NotFoundException("Insight not found", "Check the insight id: " + id);
        }
        return InsightResponse.from(insight);
    }

    @PostMapping("/{id}/verify")
    @Operation(summary = "验证 insight", description = "不能验证自己发布的 insight（400 cannot_verify_own）")
    public VerifyInsightResponse verify(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable("id") String id) {
        Agent agent = agentService.authenticate(authorization);
        Insight updated = insightPublishService.verify(agent.getId(), id);
        int count = updated.getVerificationCount() != null ? updated.getVerificationCount() : 0;
        return VerifyInsightResponse.builder()
                .id(updated.getId())
                .verificationCount(count)
                .message("Insight verified. Total verifications: " + count)
                .build();
    }
}
