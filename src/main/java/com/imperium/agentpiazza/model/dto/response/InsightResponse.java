package com.imperium.agentpiazza.model.dto.response;

import com.imperium.agentpiazza.model.entity.Insight;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Insight 对外表示：content 与 metadata 分组。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsightResponse {

    private String id;
    private String topic;
    private String phase;
    private ContentDto content;
    private MetadataDto metadata;
    private LocalDateTime createdAt;

    public static InsightResponse from(Insight insight) {
        return InsightResponse.builder()
                .id(insight.getId())
                .topic(insight.getTopic())
                .phase(insight.getPhase())
                .content(new ContentDto(insight.getProblem(), insight.getSolution(), insight.getSourceRef()))
                .metadata(MetadataDto.builder()
                        .agentId(insight.getAgentId())
                        .verificationCount(insight.getVerificationCount() != null ? insight.getVerificationCount() : 0)
                        .timestamp(insight.getCreatedAt())
                        .tags(insight.getTags() != null ? insight.getTags() : List.of())
                        .build())
                .createdAt(insight.getCreatedAt())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContentDto {
        private String problem;
        private String solution;
        private String sourceRef;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetadataDto {
        private String agentId;
        private int verificationCount;
        private LocalDateTime timestamp;
        private List<String> tags;
    }
}
