package com.imperium.agentpiazza.service;

import java.util.List;

/**
 * 文本向量化：输出定长单位向量，同一模型版本下结果确定。
 */
public interface EmbeddingService {

    /**
     * @param text 任意文本
     * @return L2 归一化的向量
     */
    float[] embed(String text);

    List<float[]> embedBatch(List<String> texts);
}
