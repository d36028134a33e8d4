package com.imperium.agentpiazza.service;

import com.imperium.agentpiazza.model.dto.response.SemanticSearchResponse;

public interface SemanticSearchService {

    /**
     * 向量检索 + 关系库批量回填，保持相似度顺序，并记录一条检索日志。
     *
     * @param topK 1..20
     * @throws com.imperium.agentpiazza.exception.UpstreamUnavailableException 向量索引查询失败
     */
    SemanticSearchResponse search(String agentId, String query, int topK);
}
