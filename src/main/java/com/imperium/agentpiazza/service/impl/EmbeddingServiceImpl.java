package com.imperium.agentpiazza.service.impl;

import com.imperium.agentpiazza.ai.embedding.VectorMath;
import com.imperium.agentpiazza.service.EmbeddingService;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Spring AI {@link EmbeddingModel} 的实现。
 * 模型输出再做一次 L2 归一化，下游可直接用点积作为余弦相似度。
 */
@Service
public class EmbeddingServiceImpl implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    public EmbeddingServiceImpl(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text) {
        return VectorMath.normalize(embeddingModel.embed(text != null ? text : ""));
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<float[]> raw = embeddingModel.embed(texts);
        List<float[]> out = new ArrayList<>(raw.size());
        for (float[] v : raw) {
            out.add(VectorMath.normalize(v));
        }
        return out;
    }
}
