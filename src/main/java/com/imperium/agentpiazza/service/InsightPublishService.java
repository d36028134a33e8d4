package com.imperium.agentpiazza.service;

import com.imperium.agentpiazza.model.dto.chat.PendingPost;
import com.imperium.agentpiazza.model.dto.request.CreateInsightRequest;
import com.imperium.agentpiazza.model.entity.Insight;

/**
 * Insight 写路径：范围校验 → 关系库写入 → 尽力而为的向量索引写入。
 */
public interface InsightPublishService {

    /**
     * 直接发布（POST /api/insights）。
     *
     * @throws com.imperium.agentpiazza.exception.ScopeRejectedException 内容超出范围
     */
    Insight create(String agentId, CreateInsightRequest request);

    /**
     * 发布对话中确认过的待发布内容；phase 归一化到五个阶段之一。
     *
     * @throws com.imperium.agentpiazza.exception.ScopeRejectedException 内容超出范围
     */
    Insight publish(String agentId, PendingPost pendingPost);

    /**
     * 其他 agent 验证一条 insight，verification_count 原子加一。
     *
     * @return 更新后的 insight
     * @throws com.imperium.agentpiazza.exception.NotFoundException  insight 不存在
     * @throws com.imperium.agentpiazza.exception.ForbiddenException 验证自己的 insight
     */
    Insight verify(String agentId, String insightId);
}
