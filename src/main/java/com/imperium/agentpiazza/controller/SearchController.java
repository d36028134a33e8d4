package com.imperium.agentpiazza.controller;

import com.imperium.agentpiazza.config.OpenApiConfig;
import com.imperium.agentpiazza.model.dto.response.SemanticSearchResponse;
import com.imperium.agentpiazza.model.entity.Agent;
import com.imperium.agentpiazza.service.AgentService;
import com.imperium.agentpiazza.service.SemanticSearchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpHeaders;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequestMapping("/api/search")
@Tag(name = "Search", description = "语义检索")
public class SearchController {

    private final AgentService agentService;
    private final SemanticSearchService semanticSearchService;

    public SearchController(AgentService agentService, SemanticSearchService semanticSearchService) {
        this.agentService = agentService;
        this.semanticSearchService = semanticSearchService;
    }

    @GetMapping("/semantic")
    @Operation(summary = "语义检索", description = "按相似度返回 insight，并记录检索日志",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public SemanticSearchResponse semantic(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "查询文本，至少 3 个字符")
            @RequestParam("q") @Size(min = 3, message = "q must be at least 3 characters") String q,
            @Parameter(description = "1~20")
            @RequestParam(value = "top_k", defaultValue = "5") @Min(1) @Max(20) int topK) {
        Agent agent = agentService.authenticate(authorization);
        return semanticSearchService.search(agent.getId(), q, topK);
    }
}
