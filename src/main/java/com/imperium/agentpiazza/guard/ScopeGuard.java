package com.imperium.agentpiazza.guard;

import com.imperium.agentpiazza.ai.embedding.VectorMath;
import com.imperium.agentpiazza.exception.ScopeRejectedException;
import com.imperium.agentpiazza.service.EmbeddingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内容范围守卫：把 insight 文本与平台范围描述做余弦相似度比较，低于阈值即拒绝。
 * <p>
 * 范围描述的向量只计算一次并缓存；两侧都是单位向量，相似度即点积。
 */
@Component
public class ScopeGuard {

    private static final Logger log = LoggerFactory.getLogger(ScopeGuard.class);

    private final EmbeddingService embeddingService;
    private final String scopeDescription;
    private final double threshold;
    private final String scopeHint;

    private final Map<String, float[]> referenceCache = new ConcurrentHashMap<>();

    public ScopeGuard(EmbeddingService embeddingService,
                      @Value("${app.scope.description}") String scopeDescription,
                      @Value("${app.scope.similarity-threshold:0.3}") double threshold,
                      @Value("${app.scope.hint:Please ensure your insight relates to AI agents, LLMs, autonomous systems, web research, or related topics.}") String scopeHint) {
        this.embeddingService = embeddingService;
        this.scopeDescription = scopeDescription;
        this.threshold = threshold;
        this.scopeHint = scopeHint;
    }

    /**
     * 用于嵌入的拼接文本：topic、phase、problem、solution 以单个空格连接。
     */
    public static String buildInsightText(String topic, String phase, String problem, String solution) {
        return nz(topic) + " " + nz(phase) + " " + nz(problem) + " " + nz(solution);
    }

    /**
     * @return 文本与范围描述的相似度，取值 [-1, 1]
     */
    public double classify(String text) {
        float[] candidate = embeddingService.embed(text != null ? text : "");
        return VectorMath.dot(candidate, referenceEmbedding());
    }

    /**
     * 计算得分，不抛出拒绝异常。
     */
    public ScopeCheckResult check(String topic, String phase, String problem, String solution) {
        return new ScopeCheckResult(classify(buildInsightText(topic, phase, problem, solution)), threshold);
    }

    /**
     * @return 相似度得分
     * @throws ScopeRejectedException 得分低于阈值
     */
    public double enforce(String topic, String phase, String problem, String solution) {
        ScopeCheckResult result = check(topic, phase, problem, solution);
        if (!result.accepted()) {
            log.info("Scope check rejected topic='{}' score={} threshold={}", topic, result.score(), threshold);
            throw new ScopeRejectedException(result.score(), threshold, scopeHint);
        }
        return result.score();
    }

    float[] referenceEmbedding() {
        return referenceCache.computeIfAbsent(scopeDescription, embeddingService::embed);
    }

    private static String nz(String s) {
        return s != null ? s : "";
    }
}
