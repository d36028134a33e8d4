package com.imperium.agentpiazza.service;

import com.imperium.agentpiazza.model.dto.search.VectorMatch;

import java.util.List;
import java.util.Map;

/**
 * 向量索引（余弦相似度）。id 为 insight 的 UUID。
 */
public interface VectorIndexService {

    /**
     * 写入或覆盖一条向量。
     *
     * @throws IllegalStateException 索引不可达或写入失败
     */
    void upsert(String id, float[] vector, Map<String, Object> metadata);

    /**
     * 按相似度降序返回至多 topK 条命中。
     */
    List<VectorMatch> query(float[] vector, int topK);

    void delete(String id);
}
