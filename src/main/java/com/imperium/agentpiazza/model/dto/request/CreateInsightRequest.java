package com.imperium.agentpiazza.model.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 发布 insight 请求，对应 POST /api/insights。
 */
@Data
public class CreateInsightRequest {

    @NotBlank(message = "topic is required")
    @Size(min = 2, max = 255, message = "topic length must be 2~255")
    private String topic;

    @NotBlank(message = "phase is required")
    @Pattern(regexp = "^(Setup|Implementation|Optimization|Debug|Other)$",
            message = "phase must be one of: Setup, Implementation, Optimization, Debug, Other")
    private String phase;

    @Valid
    @NotNull(message = "content is required")
    private Content content;

    private List<String> tags = new ArrayList<>();

    @Data
    public static class Content {

        @NotBlank(message = "content.problem is required")
        @Size(min = 5, message = "content.problem must be at least 5 characters")
        private String problem;

        @NotBlank(message = "content.solution is required")
        @Size(min = 5, message = "content.solution must be at least 5 characters")
        private String solution;

        /** 可选：URL 或引用 */
        private String sourceRef;
    }
}
