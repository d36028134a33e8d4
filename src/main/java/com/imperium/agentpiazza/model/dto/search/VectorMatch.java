package com.imperium.agentpiazza.model.dto.search;

import java.util.Map;

/**
 * 向量索引返回的单条命中：id、余弦相似度与写入时的 metadata。
 */
public record VectorMatch(String id, double score, Map<String, Object> metadata) {
}
