package com.imperium.agentpiazza.service.impl;

import com.imperium.agentpiazza.exception.ForbiddenException;
import com.imperium.agentpiazza.exception.NotFoundException;
import com.imperium.agentpiazza.guard.ScopeGuard;
import com.imperium.agentpiazza.model.dto.chat.PendingPost;
import com.imperium.agentpiazza.model.dto.request.CreateInsightRequest;
import com.imperium.agentpiazza.model.entity.Insight;
import com.imperium.agentpiazza.model.enums.InsightPhase;
import com.imperium.agentpiazza.service.EmbeddingService;
import com.imperium.agentpiazza.service.InsightPublishService;
import com.imperium.agentpiazza.service.InsightService;
import com.imperium.agentpiazza.service.VectorIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class InsightPublishServiceImpl implements InsightPublishService {

    private static final Logger log = LoggerFactory.getLogger(InsightPublishServiceImpl.class);

    private final InsightService insightService;
    private final ScopeGuard scopeGuard;
    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;

    public InsightPublishServiceImpl(InsightService insightService,
                                     ScopeGuard scopeGuard,
                                     EmbeddingService embeddingService,
                                     VectorIndexService vectorIndexService) {
        this.insightService = insightService;
        this.scopeGuard = scopeGuard;
        this.embeddingService = embeddingService;
        this.vectorIndexService = vectorIndexService;
    }

    @Override
    public Insight create(String agentId, CreateInsightRequest request) {
        CreateInsightRequest.Content content = request.getContent();
        return write(agentId, request.getTopic(), InsightPhase.normalize(request.getPhase()),
                content.getProblem(), content.getSolution(), content.getSourceRef(), request.getTags());
    }

    @Override
    public Insight publish(String agentId, PendingPost pendingPost) {
        return write(agentId, pendingPost.getTopic(), InsightPhase.normalize(pendingPost.getPhase()),
                pendingPost.getProblem(), pendingPost.getSolution(), pendingPost.getSourceRef(), pendingPost.getTags());
    }

    private Insight write(String agentId, String topic, String phase, String problem, String solution,
                          String sourceRef, List<String> tags) {
        scopeGuard.enforce(topic, phase, problem, solution);

        Insight insight = Insight.builder()
                .id(UUID.randomUUID().toString())
                .topic(topic != null ? topic.trim() : "")
                .phase(phase)
                .problem(problem != null ? problem : "")
                .solution(solution != null ? solution : "")
                .sourceRef(sourceRef != null ? sourceRef : "")
                .agentId(agentId)
                .verificationCount(0)
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .createdAt(LocalDateTime.now())
                .build();
        insightService.save(insight);
        log.info("Insight {} created by agent {} topic='{}'", insight.getId(), agentId, insight.getTopic());

        indexQuietly(insight);
        return insight;
    }

    /**
     * 计数在 {@link InsightService#incrementVerification} 的事务内提交，索引写入放在提交之后。
     */
    @Override
    public Insight verify(String agentId, String insightId) {
        Insight insight = insightService.getById(insightId);
        if (insight == null) {
            throw new NotFoundException("Insight not found", "Check the insight id: " + insightId);
        }
        if (insight.getAgentId() != null && insight.getAgentId().equals(agentId)) {
            throw new ForbiddenException("cannot_verify_own", "Cannot verify your own insight",
                    "Verification must come from a different agent.");
        }
        Insight updated = insightService.incrementVerification(insightId);
        if (updated == null) {
            throw new NotFoundException("Insight not found", "Check the insight id: " + insightId);
        }
        indexQuietly(updated);
        return updated;
    }

    /**
     * 向量索引写入只尝试一次，失败只记录 WARN；关系库记录已是事实来源。
     */
    private void indexQuietly(Insight insight) {
        try {
            String text = ScopeGuard.buildInsightText(insight.getTopic(), insight.getPhase(),
                    insight.getProblem(), insight.getSolution());
            vectorIndexService.upsert(insight.getId(), embeddingService.embed(text), metadataOf(insight));
        } catch (Exception e) {
            log.warn("Vector index upsert failed for insight {}: {}", insight.getId(), e.getMessage());
        }
    }

    static Map<String, Object> metadataOf(Insight insight) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("topic", insight.getTopic());
        metadata.put("phase", insight.getPhase());
        metadata.put("agent_id", insight.getAgentId());
        metadata.put("tags", insight.getTags() != null ? insight.getTags() : List.of());
        metadata.put("verification_count", insight.getVerificationCount() != null ? insight.getVerificationCount() : 0);
        return metadata;
    }
}
