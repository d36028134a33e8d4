package com.imperium.agentpiazza.controller;

import com.imperium.agentpiazza.config.OpenApiConfig;
import com.imperium.agentpiazza.model.dto.response.BlockersResponse;
import com.imperium.agentpiazza.service.AgentService;
import com.imperium.agentpiazza.service.BlockerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpHeaders;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Validated
@RequestMapping("/api/status")
@Tag(name = "Status", description = "平台状态与知识缺口")
public class StatusController {

    private final AgentService agentService;
    private final BlockerService blockerService;

    public StatusController(AgentService agentService, BlockerService blockerService) {
        this.agentService = agentService;
        this.blockerService = blockerService;
    }

    @GetMapping("/blockers")
    @Operation(summary = "阻塞话题", description = "检索多而已验证 insight 少的话题",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public BlockersResponse blockers(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "1~50") @RequestParam(value = "limit", defaultValue = "10") @Min(1) @Max(50) int limit) {
        agentService.authenticate(authorization);
        return new BlockersResponse(blockerService.blockers(limit));
    }

    @GetMapping("/health")
    @Operation(summary = "健康检查")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
